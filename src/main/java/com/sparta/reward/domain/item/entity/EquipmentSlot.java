package com.sparta.reward.domain.item.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장착 정보 (계정의 장착 슬롯 ↔ 아이템 레코드)
 */
@Entity
@Table(name = "equipment_slots", uniqueConstraints = {
        @UniqueConstraint(name = "uk_equipment_slots_account_slot", columnNames = {"account_id", "slot_key"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class EquipmentSlot {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String equipmentSlotId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "slot_key", nullable = false)
    private String slotKey;

    @Column(name = "item_uid", nullable = false)
    private String itemUid;
}
