package com.sparta.reward.application.inventory.dto;

import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.vo.SubOption;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 인벤토리 아이템 응답 DTO
 */
public record InventoryItemResponse(
        @Schema(description = "아이템 UID", example = "0b6f7a2e-2f51-4c1a-9a5e-7f3a1c2d9e10")
        String itemUid,

        @Schema(description = "아이템 타입 키", example = "ITEM_SWORD_SSR")
        String itemTypeKey,

        @Schema(description = "수량", example = "1")
        int amount,

        @Schema(description = "장착 여부", example = "false")
        boolean equipped,

        @Schema(description = "서브 옵션 목록")
        List<OptionResponse> options
) {

    public record OptionResponse(
            @Schema(description = "옵션 키", example = "ATK_PERCENT")
            String optionKey,

            @Schema(description = "옵션 값", example = "12")
            int optionValue
    ) {
        public static OptionResponse from(SubOption option) {
            return new OptionResponse(option.optionKey(), option.optionValue());
        }
    }

    public static InventoryItemResponse from(InventoryItem item, boolean equipped) {
        return new InventoryItemResponse(
                item.getItemUid(),
                item.getItemTypeKey(),
                item.getAmount(),
                equipped,
                item.getOptions().stream()
                        .map(OptionResponse::from)
                        .toList()
        );
    }
}
