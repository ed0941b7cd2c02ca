package com.sparta.reward.application.inventory.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 인벤토리 조회 응답 DTO
 */
public record InventoryResponse(
        @Schema(description = "계정 ID", example = "A001")
        String accountId,

        @Schema(description = "사용 중인 슬롯 수", example = "37")
        int usedSlots,

        @Schema(description = "최대 슬롯 수", example = "200")
        int maxCapacity,

        @Schema(description = "아이템 목록 (획득순)")
        List<InventoryItemResponse> items
) {
}
