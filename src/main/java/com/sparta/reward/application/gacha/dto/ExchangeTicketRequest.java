package com.sparta.reward.application.gacha.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 뽑기 티켓 교환 요청 DTO
 */
public record ExchangeTicketRequest(
        @Schema(description = "계정 ID", example = "A001")
        @NotBlank(message = "계정 ID는 필수입니다")
        String accountId,

        @Schema(description = "교환할 티켓 수량", example = "10")
        @Min(value = 1, message = "교환 수량은 1 이상이어야 합니다")
        @Max(value = 1000, message = "교환 수량은 1000 이하여야 합니다")
        int amount
) {
}
