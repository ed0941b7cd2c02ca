package com.sparta.reward.domain.reward;

/**
 * 보상 타입
 */
public enum RewardType {
    NONE,
    ITEM,
    CURRENCY,
    PLAYER_CHARACTER,
    REWARD_DATA,    // 다른 보상 테이블 행을 참조하는 복합 보상 (amount = 반복 횟수)
    GACHA           // 보상 테이블에서 amount 회 뽑기 (천장 적용)
}
