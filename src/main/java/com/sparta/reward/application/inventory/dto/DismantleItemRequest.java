package com.sparta.reward.application.inventory.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * 아이템 분해 요청 DTO
 */
public record DismantleItemRequest(
        @Schema(description = "계정 ID", example = "A001")
        @NotBlank(message = "계정 ID는 필수입니다")
        String accountId
) {
}
