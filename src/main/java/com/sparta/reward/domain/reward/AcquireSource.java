package com.sparta.reward.domain.reward;

/**
 * 보상 획득 경로
 * NONE 이외의 경로는 인벤토리 슬롯 예측을 생략하고 지급 검증만 수행한다
 */
public enum AcquireSource {
    NONE,
    EXCHANGE,
    PURCHASE
}
