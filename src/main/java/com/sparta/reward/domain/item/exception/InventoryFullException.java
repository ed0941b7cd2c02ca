package com.sparta.reward.domain.item.exception;

import com.sparta.reward.common.exception.BusinessException;
import com.sparta.reward.common.exception.ErrorCode;

/**
 * 보상 지급 시 인벤토리 용량을 초과할 때 발생하는 예외
 */
public class InventoryFullException extends BusinessException {
    public InventoryFullException() {
        super(ErrorCode.I001);
    }

    public InventoryFullException(int predictedSlots, int maxCapacity) {
        super(ErrorCode.I001,
              String.format("인벤토리가 가득 찼습니다. 예상 슬롯: %d, 최대 용량: %d", predictedSlots, maxCapacity));
    }
}
