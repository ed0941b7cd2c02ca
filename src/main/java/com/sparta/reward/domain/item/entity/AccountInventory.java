package com.sparta.reward.domain.item.entity;

import com.sparta.reward.infrastructure.jpa.BaseEntity;
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
 * 계정별 인벤토리 용량
 */
@Entity
@Table(name = "account_inventories")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AccountInventory extends BaseEntity {

    @Id
    @Column(name = "account_id")
    private String accountId;

    @Column(name = "max_capacity", nullable = false)
    private int maxCapacity;
}
