package com.sparta.reward.domain.reward.repository;

import com.sparta.reward.domain.reward.entity.RewardTable;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 보상 테이블 저장소
 */
public interface RewardTableRepository extends JpaRepository<RewardTable, String> {
}
