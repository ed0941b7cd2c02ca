package com.sparta.reward.application.gacha.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 가챠 뽑기 응답 DTO
 */
public record GachaDrawResponse(
        @Schema(description = "계정 ID", example = "A001")
        String accountId,

        @Schema(description = "뽑기 횟수", example = "10")
        int drawCount,

        @Schema(description = "획득 보상 목록 (병합 후)")
        List<RewardResponse> rewards,

        @Schema(description = "천장 등급 이상 획득 여부 (연출용)", example = "false")
        boolean highGrade,

        @Schema(description = "뽑기 후 천장 진행 상황")
        PityStatusResponse pity
) {
}
