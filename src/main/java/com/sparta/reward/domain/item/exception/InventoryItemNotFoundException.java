package com.sparta.reward.domain.item.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

/**
 * 아이템 레코드를 찾을 수 없을 때 발생하는 예외
 */
public class InventoryItemNotFoundException extends BusinessException {
    public InventoryItemNotFoundException(String itemUid) {
        super(ErrorCode.I003, "아이템을 찾을 수 없습니다: " + itemUid);
    }
}
