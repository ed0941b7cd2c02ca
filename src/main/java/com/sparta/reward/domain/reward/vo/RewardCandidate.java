package com.sparta.reward.domain.reward.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;

/**
 * 랜덤 보상 후보
 * pickupGroup은 천장 판정에 쓰이는 등급 (0 = 등급 없음)
 */
@Embeddable
public record RewardCandidate(
        @Embedded
        RewardHandler reward,

        @Column(name = "weight", nullable = false)
        int weight,

        @Column(name = "pickup_group", nullable = false)
        int pickupGroup
) {

    public RewardCandidate {
        if (reward == null) {
            throw new IllegalArgumentException("후보 보상은 null일 수 없습니다");
        }
        if (weight < 1) {
            throw new IllegalArgumentException("가중치는 1 이상이어야 합니다");
        }
        if (pickupGroup < 0) {
            throw new IllegalArgumentException("픽업 그룹은 음수일 수 없습니다");
        }
    }

    public static RewardCandidate of(RewardHandler reward, int weight) {
        return new RewardCandidate(reward, weight, 0);
    }

    public boolean isAtLeastTier(int minTier) {
        return pickupGroup >= minTier;
    }
}
