package com.sparta.reward.application.reward;

import com.sparta.reward.domain.gacha.vo.GachaDraw;
import com.sparta.reward.domain.gacha.vo.PityState;
import com.sparta.reward.domain.reward.vo.RewardHandler;

import java.util.List;
import java.util.Map;

/**
 * 보상 지급 결과
 *
 * @param rewards 실제 지급된 (병합된) 보상 목록
 * @param draws 이번 배치의 뽑기 결과
 * @param pityStates 저장된 천장 상태 (가챠 보상 행 키별)
 */
public record RewardGrantResult(
        List<RewardHandler> rewards,
        List<GachaDraw> draws,
        Map<String, PityState> pityStates
) {

    public boolean hasHighGrade() {
        return draws.stream().anyMatch(GachaDraw::highGrade);
    }
}
