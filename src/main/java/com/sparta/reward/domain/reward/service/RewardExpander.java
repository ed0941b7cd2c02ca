package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.entity.RewardTable;
import com.sparta.reward.domain.reward.exception.RecursionOverrunException;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.repository.RewardTableRepository;
import com.sparta.reward.domain.reward.vo.RewardCandidate;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 복합 보상 전개기
 *
 * REWARD_DATA 타입 보상을 만나면 참조하는 행을 amount 회 재귀 전개한다.
 * GACHA 타입 보상은 NestedGachaDrawer로 추첨한 뒤 결과를 이어서 전개한다.
 * 예: 가챠 → 보상팩 → 실제 보상들, 보상팩 → 가챠 → 실제 보상들
 *
 * 전개 경로(행 키 스택)로 순환 참조를 막고, 경로 길이가 maxDepth를 넘으면 중단한다.
 */
@Slf4j
@Component
public class RewardExpander {

    private final RewardTableRepository rewardTableRepository;
    private final WeightedSelector weightedSelector;
    private final int maxDepth;

    public RewardExpander(RewardTableRepository rewardTableRepository,
                          WeightedSelector weightedSelector,
                          @Value("${reward.expansion.max-depth:16}") int maxDepth) {
        this.rewardTableRepository = rewardTableRepository;
        this.weightedSelector = weightedSelector;
        this.maxDepth = maxDepth;
    }

    /**
     * 보상 테이블 행 전개
     *
     * @param nestedGacha 행 안의 GACHA 보상 추첨기
     * @return 복합 보상이 없는 평탄화된 보상 목록 (순서 유지)
     * @throws RewardConfigurationException 전개 결과가 비어 있거나 설정이 잘못된 경우
     * @throws RecursionOverrunException 순환 참조 또는 최대 깊이 초과
     */
    public List<RewardHandler> expand(RewardTable row, NestedGachaDrawer nestedGacha) {
        List<RewardHandler> result = new ArrayList<>();
        expandRow(row, result, new ArrayDeque<>(), nestedGacha);

        if (result.isEmpty()) {
            throw new RewardConfigurationException("보상 전개 결과가 비어 있습니다: " + row.getRewardKey());
        }
        return result;
    }

    /**
     * 보상 목록 전개 (순서 유지)
     * 복합 보상이나 가챠 보상이 아무것도 남기지 않으면 설정 오류다
     */
    public List<RewardHandler> expandAll(List<RewardHandler> handlers, NestedGachaDrawer nestedGacha) {
        List<RewardHandler> result = new ArrayList<>();
        for (RewardHandler handler : handlers) {
            int before = result.size();
            addReward(handler, result, new ArrayDeque<>(), nestedGacha);

            if (result.size() == before && handler != null && !handler.isNone()) {
                throw new RewardConfigurationException("보상 전개 결과가 비어 있습니다: " + handler.typeKey());
            }
        }
        return result;
    }

    private void expandRow(RewardTable row, List<RewardHandler> out, Deque<String> path, NestedGachaDrawer nestedGacha) {
        String rewardKey = row.getRewardKey();
        enter(rewardKey, path);
        log.debug("보상 전개 - rewardKey={}, statics={}, randoms={}",
                rewardKey, row.getStatics().size(), row.getRandoms().size());

        // 고정 보상 추가
        for (RewardHandler handler : row.getStatics()) {
            addReward(handler, out, path, nestedGacha);
        }

        // 랜덤 보상 추첨 (정확히 1회)
        if (row.hasRandoms()) {
            RewardCandidate selected = weightedSelector.pick(row.getRandoms(), row.getTotalWeight())
                    .orElseThrow(() -> new RewardConfigurationException(
                            "랜덤 보상 추첨에 실패했습니다: " + rewardKey + " (totalWeight=" + row.getTotalWeight() + ")"));
            log.debug("랜덤 보상 선택 - rewardKey={}, selected={}", rewardKey, selected.reward().typeKey());
            addReward(selected.reward(), out, path, nestedGacha);
        }

        path.removeLast();
    }

    private void addReward(RewardHandler handler, List<RewardHandler> out, Deque<String> path,
                           NestedGachaDrawer nestedGacha) {
        if (handler == null || handler.isNone()) {
            return;
        }

        if (handler.rewardType() == RewardType.GACHA) {
            // 가챠 행도 전개 경로에 포함해 가챠 → 보상팩 → 같은 가챠 순환을 막는다
            enter(handler.typeKey(), path);
            for (RewardHandler drawn : nestedGacha.draw(handler)) {
                addReward(drawn, out, path, nestedGacha);
            }
            path.removeLast();
            return;
        }

        if (!handler.isComposite()) {
            out.add(handler);
            return;
        }

        RewardTable referenced = rewardTableRepository.findById(handler.typeKey())
                .orElseThrow(() -> new RewardConfigurationException("보상 테이블을 찾을 수 없습니다: " + handler.typeKey()));

        // amount = 반복 횟수
        for (int i = 0; i < handler.amount(); i++) {
            expandRow(referenced, out, path, nestedGacha);
        }
    }

    private void enter(String rewardKey, Deque<String> path) {
        if (path.contains(rewardKey) || path.size() >= maxDepth) {
            log.error("보상 전개 중단 - rewardKey={}, path={}", rewardKey, path);
            throw new RecursionOverrunException(rewardKey, List.copyOf(path));
        }
        path.addLast(rewardKey);
    }
}
