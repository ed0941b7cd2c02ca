package com.sparta.reward.domain.item.vo;

import com.sparta.reward.domain.item.entity.InventoryItem;

/**
 * 같은 요청 안에서 보상 시뮬레이션 이전에 예정된 아이템 변경
 *
 * 슬롯 영향:
 * - 스택 불가 아이템: amountDelta 만큼 슬롯 증감
 * - 스택 가능 아이템: CREATED +1, DELETED -1, AMOUNT_CHANGED 0
 */
public record StagedItemChange(
        String itemTypeKey,
        int amountDelta,
        ChangeKind kind
) {

    public enum ChangeKind {
        CREATED,
        DELETED,
        AMOUNT_CHANGED
    }

    /**
     * 아이템 레코드 전체 제거 예정
     */
    public static StagedItemChange removalOf(InventoryItem item) {
        return new StagedItemChange(item.getItemTypeKey(), -item.getAmount(), ChangeKind.DELETED);
    }
}
