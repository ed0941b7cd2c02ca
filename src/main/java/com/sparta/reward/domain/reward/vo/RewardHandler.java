package com.sparta.reward.domain.reward.vo;

import com.sparta.reward.domain.reward.AcquireSource;
import com.sparta.reward.domain.reward.RewardType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * 보상 단위 Value Object
 * amount가 음수면 소모를 의미한다
 */
@Embeddable
public record RewardHandler(
        @Enumerated(EnumType.STRING)
        @Column(name = "reward_type", nullable = false)
        RewardType rewardType,

        @Column(name = "type_key")
        String typeKey,

        @Column(name = "amount", nullable = false)
        int amount,

        @Enumerated(EnumType.STRING)
        @Column(name = "acquire_source", nullable = false)
        AcquireSource acquireSource
) {

    private static final RewardHandler NONE = new RewardHandler(RewardType.NONE, null, 0, AcquireSource.NONE);

    public RewardHandler {
        if (rewardType == null) {
            rewardType = RewardType.NONE;
        }
        if (acquireSource == null) {
            acquireSource = AcquireSource.NONE;
        }
    }

    public static RewardHandler of(RewardType rewardType, String typeKey, int amount) {
        return new RewardHandler(rewardType, typeKey, amount, AcquireSource.NONE);
    }

    public static RewardHandler item(String itemTypeKey, int amount) {
        return of(RewardType.ITEM, itemTypeKey, amount);
    }

    public static RewardHandler currency(String currencyKey, int amount) {
        return of(RewardType.CURRENCY, currencyKey, amount);
    }

    public static RewardHandler rewardData(String rewardKey, int repeat) {
        return of(RewardType.REWARD_DATA, rewardKey, repeat);
    }

    public static RewardHandler gacha(String rewardKey, int drawCount) {
        return of(RewardType.GACHA, rewardKey, drawCount);
    }

    /**
     * "보상 없음" 센티널
     */
    public static RewardHandler none() {
        return NONE;
    }

    public boolean isNone() {
        return rewardType == RewardType.NONE;
    }

    public boolean isComposite() {
        return rewardType == RewardType.REWARD_DATA;
    }

    public boolean isItem() {
        return rewardType == RewardType.ITEM;
    }

    public boolean isConsumption() {
        return amount < 0;
    }

    public RewardHandler withAmount(int newAmount) {
        return new RewardHandler(rewardType, typeKey, newAmount, acquireSource);
    }

    public RewardHandler withSource(AcquireSource source) {
        return new RewardHandler(rewardType, typeKey, amount, source);
    }
}
