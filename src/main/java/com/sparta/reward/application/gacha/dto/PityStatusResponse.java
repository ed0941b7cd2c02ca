package com.sparta.reward.application.gacha.dto;

import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.vo.PityState;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 천장 진행 상황 응답 DTO
 */
public record PityStatusResponse(
        @Schema(description = "캠페인 키", example = "GACHA_WEAPON_01")
        String campaignKey,

        @Schema(description = "일반 천장 카운터", example = "3")
        int normalCounter,

        @Schema(description = "천장 카운터", example = "43")
        int specialCounter,

        @Schema(description = "일반 천장까지 남은 횟수 (비활성이면 null)", example = "7")
        Integer remainingToNormal,

        @Schema(description = "천장까지 남은 횟수 (비활성이면 null)", example = "47")
        Integer remainingToSpecial
) {
    public static PityStatusResponse of(GachaCampaign campaign, PityState state) {
        return new PityStatusResponse(
                campaign.getCampaignKey(),
                state.getNormal(),
                state.getSpecial(),
                campaign.hasNormalGuarantee() ? state.remainingToNormal() : null,
                campaign.hasSpecialGuarantee() ? state.remainingToSpecial(campaign) : null
        );
    }
}
