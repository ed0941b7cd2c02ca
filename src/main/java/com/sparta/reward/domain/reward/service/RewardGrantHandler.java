package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.vo.RewardHandler;

/**
 * 보상 타입별 지급 처리기
 */
public interface RewardGrantHandler {

    RewardType supportedType();

    /**
     * 지급 가능 여부 검증 (상태를 변경하지 않음)
     */
    boolean simulate(String accountId, RewardHandler reward);

    /**
     * 지급 (시뮬레이션 성공 후에만 호출)
     */
    void apply(String accountId, RewardHandler reward);
}
