package com.sparta.reward.application.gacha.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 뽑기 티켓 교환 응답 DTO
 */
public record ExchangeTicketResponse(
        @Schema(description = "계정 ID", example = "A001")
        String accountId,

        @Schema(description = "티켓 아이템 키", example = "ITEM_GACHA_TICKET")
        String ticketItemKey,

        @Schema(description = "교환된 티켓 수량", example = "10")
        int ticketAmount,

        @Schema(description = "소모 재화 키", example = "GEM")
        String currencyKey,

        @Schema(description = "소모 재화량", example = "1600")
        long spentAmount
) {
}
