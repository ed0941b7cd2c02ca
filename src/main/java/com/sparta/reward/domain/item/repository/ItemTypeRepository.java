package com.sparta.reward.domain.item.repository;

import com.sparta.reward.domain.item.entity.ItemType;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 아이템 타입 저장소
 */
public interface ItemTypeRepository extends JpaRepository<ItemType, String> {
}
