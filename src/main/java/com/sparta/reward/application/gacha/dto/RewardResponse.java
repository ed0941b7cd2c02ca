package com.sparta.reward.application.gacha.dto;

import com.sparta.reward.domain.reward.AcquireSource;
import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 지급 보상 응답 DTO
 */
public record RewardResponse(
        @Schema(description = "보상 타입", example = "ITEM")
        RewardType rewardType,

        @Schema(description = "보상 키", example = "ITEM_SWORD_SSR")
        String typeKey,

        @Schema(description = "수량 (음수면 소모)", example = "1")
        int amount,

        @Schema(description = "획득 경로", example = "NONE")
        AcquireSource acquireSource
) {
    public static RewardResponse from(RewardHandler reward) {
        return new RewardResponse(
                reward.rewardType(),
                reward.typeKey(),
                reward.amount(),
                reward.acquireSource()
        );
    }
}
