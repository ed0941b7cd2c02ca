package com.sparta.reward.domain.reward.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

/**
 * 보상 설정 데이터가 잘못되었을 때 발생하는 예외
 * (행 누락, 가중치 합 0 이하, 후보 없음 등) 재시도 대상이 아니다
 */
public class RewardConfigurationException extends BusinessException {
    public RewardConfigurationException() {
        super(ErrorCode.R001);
    }

    public RewardConfigurationException(String message) {
        super(ErrorCode.R001, message);
    }
}
