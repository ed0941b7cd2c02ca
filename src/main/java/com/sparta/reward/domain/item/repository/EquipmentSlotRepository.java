package com.sparta.reward.domain.item.repository;

import com.sparta.reward.domain.item.entity.EquipmentSlot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * 장착 정보 저장소
 */
public interface EquipmentSlotRepository extends JpaRepository<EquipmentSlot, String> {

    Optional<EquipmentSlot> findByItemUid(String itemUid);

    boolean existsByItemUid(String itemUid);

    List<EquipmentSlot> findByAccountId(String accountId);
}
