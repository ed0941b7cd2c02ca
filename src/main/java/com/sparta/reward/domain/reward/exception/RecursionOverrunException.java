package com.sparta.reward.domain.reward.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

import java.util.Collection;

/**
 * 복합 보상 전개가 최대 깊이를 넘거나 순환 참조를 만났을 때 발생하는 예외
 */
public class RecursionOverrunException extends BusinessException {
    public RecursionOverrunException(String rewardKey, Collection<String> path) {
        super(ErrorCode.R002,
              String.format("보상 데이터 전개 깊이를 초과했습니다. rewardKey: %s, 경로: %s", rewardKey, path));
    }
}
