package com.sparta.reward.application.inventory.dto;

import com.sparta.reward.application.gacha.dto.RewardResponse;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 아이템 분해 응답 DTO
 */
public record DismantleItemResponse(
        @Schema(description = "분해된 아이템 UID", example = "0b6f7a2e-2f51-4c1a-9a5e-7f3a1c2d9e10")
        String itemUid,

        @Schema(description = "분해된 아이템 타입 키", example = "ITEM_SWORD_R")
        String itemTypeKey,

        @Schema(description = "분해된 수량", example = "1")
        int dismantledAmount,

        @Schema(description = "분해 보상 목록")
        List<RewardResponse> rewards
) {
}
