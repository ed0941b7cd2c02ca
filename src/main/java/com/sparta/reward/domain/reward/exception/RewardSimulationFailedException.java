package com.sparta.reward.domain.reward.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;
import com.sparta.reward.domain.reward.vo.RewardHandler;

/**
 * 개별 보상 지급 검증에 실패했을 때 발생하는 예외
 */
public class RewardSimulationFailedException extends BusinessException {
    public RewardSimulationFailedException(RewardHandler reward) {
        super(ErrorCode.R003,
              String.format("보상 지급 조건을 만족하지 않습니다. 타입: %s, 키: %s, 수량: %d",
                      reward.rewardType(), reward.typeKey(), reward.amount()));
    }
}
