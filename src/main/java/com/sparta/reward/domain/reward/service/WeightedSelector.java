package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.reward.vo.RewardCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.ToIntFunction;

/**
 * 가중치 기반 랜덤 추첨기
 *
 * 알고리즘:
 * 1. 1부터 총 가중치 사이의 랜덤 값 생성
 * 2. 누적 가중치가 랜덤 값 이상이 되는 첫 번째 후보 선택
 *
 * 예시:
 * - 보상A (가중치 70): 1~70 범위
 * - 보상B (가중치 25): 71~95 범위
 * - 보상C (가중치 5):  96~100 범위
 *
 * 누적 경계값과 랜덤 값이 같으면 항상 앞쪽 후보가 선택된다.
 */
@Component
@RequiredArgsConstructor
public class WeightedSelector {

    private final Random random;

    /**
     * 가중치 추첨
     *
     * @param candidates 후보 목록
     * @param weightOf 후보별 가중치
     * @param totalWeight 가중치 합 (미리 계산된 값)
     * @return 선택된 후보, 후보가 없거나 totalWeight가 0 이하면 empty
     */
    public <T> Optional<T> pick(List<T> candidates, ToIntFunction<T> weightOf, int totalWeight) {
        if (candidates == null || candidates.isEmpty() || totalWeight <= 0) {
            return Optional.empty();
        }

        int randomNumber = random.nextInt(totalWeight) + 1;
        int cumulative = 0;
        for (T candidate : candidates) {
            cumulative += weightOf.applyAsInt(candidate);
            if (cumulative >= randomNumber) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * 보상 후보 가중치 추첨
     */
    public Optional<RewardCandidate> pick(List<RewardCandidate> candidates, int totalWeight) {
        return pick(candidates, RewardCandidate::weight, totalWeight);
    }

    /**
     * 등급 보장 추첨
     * minTier 이상의 후보만 남긴 뒤 가중치를 무시하고 균등하게 하나를 선택한다
     */
    public Optional<RewardCandidate> pickAtLeastTier(List<RewardCandidate> candidates, int minTier) {
        if (candidates == null) {
            return Optional.empty();
        }
        List<RewardCandidate> qualified = candidates.stream()
                .filter(candidate -> candidate.isAtLeastTier(minTier))
                .toList();
        if (qualified.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(qualified.get(random.nextInt(qualified.size())));
    }
}
