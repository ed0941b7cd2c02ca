package com.sparta.reward.domain.currency.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

/**
 * 재화가 부족할 때 발생하는 예외
 */
public class InsufficientCurrencyException extends BusinessException {
    public InsufficientCurrencyException(String currencyKey) {
        super(ErrorCode.CUR001, "재화가 부족합니다: " + currencyKey);
    }

    public InsufficientCurrencyException(String currencyKey, long requested, long available) {
        super(ErrorCode.CUR001,
              String.format("재화가 부족합니다. 재화: %s, 요청: %d, 잔액: %d", currencyKey, requested, available));
    }
}
