package com.sparta.reward.domain.gacha.vo;

import com.sparta.reward.domain.reward.vo.RewardHandler;

/**
 * 뽑기 1회 결과
 *
 * @param reward 추첨된 보상 (복합 보상일 수 있음)
 * @param pickupGroup 추첨된 후보의 등급
 * @param mode 추첨 방식
 * @param highGrade 천장 등급(specialPickupGroup) 이상 여부
 */
public record GachaDraw(
        RewardHandler reward,
        int pickupGroup,
        DrawMode mode,
        boolean highGrade
) {
}
