package com.sparta.reward.domain.item.repository;

import com.sparta.reward.domain.item.entity.SubOptionDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * 서브 옵션 풀 저장소
 */
public interface SubOptionDefinitionRepository extends JpaRepository<SubOptionDefinition, Long> {

    List<SubOptionDefinition> findByPoolKey(String poolKey);
}
