package com.sparta.reward.domain.gacha.service;

import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.vo.DrawMode;
import com.sparta.reward.domain.gacha.vo.GachaDraw;
import com.sparta.reward.domain.gacha.vo.PityState;
import com.sparta.reward.domain.reward.entity.RewardTable;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.service.WeightedSelector;
import com.sparta.reward.domain.reward.vo.RewardCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 가챠 뽑기 (천장 상태 머신)
 *
 * 각 뽑기마다:
 * 1. 두 카운터 증가
 * 2. Special Pity 체크 (specialTryCount 회 천장) → 두 카운터 리셋
 * 3. Normal Pity 체크 (10회 천장) → normal 카운터만 리셋
 * 4. 일반 가중치 추첨 → 높은 등급이면 보장과 동일하게 카운터 리셋
 *
 * PityState는 호출자가 배치 단위로 로드/저장한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GachaDrawer {

    private final WeightedSelector weightedSelector;

    public List<GachaDraw> draw(RewardTable row, GachaCampaign campaign, PityState state, int drawCount) {
        if (drawCount <= 0) {
            throw new IllegalArgumentException("뽑기 횟수는 1 이상이어야 합니다");
        }
        if (!row.hasRandoms() || row.getTotalWeight() <= 0) {
            throw new RewardConfigurationException("가챠 후보가 없거나 가중치 합이 0 이하입니다: " + row.getRewardKey());
        }

        List<GachaDraw> draws = new ArrayList<>(drawCount);
        for (int i = 0; i < drawCount; i++) {
            draws.add(drawOnce(row, campaign, state));
        }

        log.debug("[Gacha] {} - Normal: {}/{}, Special: {}/{}",
                row.getRewardKey(),
                state.getNormal(), GachaCampaign.NORMAL_TRY_COUNT,
                state.getSpecial(), campaign.getSpecialTryCount());
        return draws;
    }

    private GachaDraw drawOnce(RewardTable row, GachaCampaign campaign, PityState state) {
        state.increment();
        DrawMode mode = state.decideMode(campaign);

        RewardCandidate selected = switch (mode) {
            case SPECIAL_GUARANTEE -> pickGuaranteed(row, campaign.getSpecialPickupGroup());
            case NORMAL_GUARANTEE -> pickGuaranteed(row, campaign.getNormalPickupGroup());
            case RANDOM -> weightedSelector.pick(row.getRandoms(), row.getTotalWeight())
                    .orElseThrow(() -> new RewardConfigurationException("가챠 추첨에 실패했습니다: " + row.getRewardKey()));
        };

        if (mode == DrawMode.RANDOM) {
            state.onRandomDraw(selected.pickupGroup(), campaign);
        } else {
            state.onGuaranteed(mode);
        }

        boolean highGrade = campaign.hasSpecialGuarantee()
                && selected.pickupGroup() >= campaign.getSpecialPickupGroup();
        log.debug("[Gacha] 추첨 결과 - reward={}, pickupGroup={}, mode={}",
                selected.reward().typeKey(), selected.pickupGroup(), mode);
        return new GachaDraw(selected.reward(), selected.pickupGroup(), mode, highGrade);
    }

    private RewardCandidate pickGuaranteed(RewardTable row, int minTier) {
        return weightedSelector.pickAtLeastTier(row.getRandoms(), minTier)
                .orElseThrow(() -> new RewardConfigurationException(
                        "보장 등급 후보가 없습니다: " + row.getRewardKey() + " (PickupGroup >= " + minTier + ")"));
    }
}
