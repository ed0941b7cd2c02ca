package com.sparta.reward.domain.item.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

/**
 * 아이템 수량이 유효하지 않을 때 발생하는 예외
 */
public class InvalidItemQuantityException extends BusinessException {
    public InvalidItemQuantityException() {
        super(ErrorCode.I002);
    }

    public InvalidItemQuantityException(String message) {
        super(ErrorCode.I002, message);
    }
}
