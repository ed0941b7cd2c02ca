package com.sparta.reward.domain.gacha.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가챠 캠페인 설정
 *
 * 천장 시스템:
 * - Normal Pity: 10회마다 normalPickupGroup 이상 보장
 * - Special Pity: specialTryCount 회마다 specialPickupGroup 이상 보장
 * 픽업 그룹이 0이면 해당 천장은 비활성화
 */
@Entity
@Table(name = "gacha_campaigns", indexes = {
        @Index(name = "idx_gacha_campaigns_group", columnList = "reward_group_key")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class GachaCampaign {

    public static final int NORMAL_TRY_COUNT = 10;

    @Id
    @Column(name = "campaign_key")
    private String campaignKey;

    @Column(name = "name")
    private String name;

    // 추첨 대상 보상 테이블 행
    @Column(name = "reward_key", nullable = false)
    private String rewardKey;

    @Column(name = "reward_group_key", nullable = false)
    private String rewardGroupKey;

    @Column(name = "normal_pickup_group", nullable = false)
    private int normalPickupGroup;

    @Column(name = "special_pickup_group", nullable = false)
    private int specialPickupGroup;

    @Column(name = "special_try_count", nullable = false)
    private int specialTryCount;

    // 1회 뽑기에 소모되는 티켓 (null이면 티켓 없이 뽑기)
    @Column(name = "ticket_item_key")
    private String ticketItemKey;

    @Column(name = "exchange_currency_key")
    private String exchangeCurrencyKey;

    @Column(name = "exchange_price", nullable = false)
    private int exchangePrice;

    public boolean hasNormalGuarantee() {
        return normalPickupGroup > 0;
    }

    public boolean hasSpecialGuarantee() {
        return specialPickupGroup > 0;
    }

    public boolean usesTicket() {
        return ticketItemKey != null && !ticketItemKey.isBlank();
    }

    public boolean isExchangeable() {
        return usesTicket() && exchangeCurrencyKey != null && exchangePrice > 0;
    }

    /**
     * 티켓 교환 비용
     */
    public long exchangeCost(int ticketAmount) {
        return (long) exchangePrice * ticketAmount;
    }
}
