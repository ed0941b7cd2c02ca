package com.sparta.reward.application.gacha.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 가챠 뽑기 요청 DTO
 */
public record DrawGachaRequest(
        @Schema(description = "계정 ID", example = "A001")
        @NotBlank(message = "계정 ID는 필수입니다")
        String accountId,

        @Schema(description = "뽑기 횟수", example = "10")
        @Min(value = 1, message = "뽑기 횟수는 1 이상이어야 합니다")
        @Max(value = 100, message = "뽑기 횟수는 100 이하여야 합니다")
        int drawCount
) {
}
