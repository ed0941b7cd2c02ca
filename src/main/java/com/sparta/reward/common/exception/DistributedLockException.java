package com.sparta.reward.common.exception;

/**
 * 분산 락 획득에 실패했을 때 발생하는 예외
 */
public class DistributedLockException extends BusinessException {
    public DistributedLockException(String lockKey) {
        super(ErrorCode.COMMON005, "락 획득에 실패했습니다: " + lockKey);
    }

    public DistributedLockException(String lockKey, Throwable cause) {
        super(ErrorCode.COMMON005, "락 획득에 실패했습니다: " + lockKey, cause);
    }
}
