package com.sparta.reward.domain.item.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 아이템 타입 메타데이터 (정적 설정 데이터)
 */
@Entity
@Table(name = "item_types")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ItemType {

    @Id
    @Column(name = "item_type_key")
    private String itemTypeKey;

    @Column(name = "name")
    private String name;

    @Column(name = "max_stack", nullable = false)
    private int maxStack;

    @Column(name = "requires_slot", nullable = false)
    private boolean requiresSlot;

    @Column(name = "equipment", nullable = false)
    private boolean equipment;

    @Column(name = "sub_option_pool_key")
    private String subOptionPoolKey;

    @Column(name = "sub_option_count", nullable = false)
    private int subOptionCount;

    // 분해 시 지급되는 보상 테이블 행 (null이면 분해 불가)
    @Column(name = "dismantle_reward_key")
    private String dismantleRewardKey;

    /**
     * 스택 가능 여부 (최대 스택이 1보다 크면 스택 가능)
     */
    public boolean isStackable() {
        return maxStack > 1;
    }

    /**
     * 수량을 [0, maxStack] 범위로 보정
     */
    public int clamp(int amount) {
        return Math.max(0, Math.min(amount, Math.max(maxStack, 1)));
    }

    public boolean isDismantlable() {
        return dismantleRewardKey != null && !dismantleRewardKey.isBlank();
    }
}
