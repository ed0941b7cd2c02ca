package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.gacha.vo.GachaDraw;
import com.sparta.reward.domain.gacha.vo.PitySession;
import com.sparta.reward.domain.reward.vo.RewardHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 보상 요청 배치의 전개 결과
 * 요청별 평탄화 결과, 뽑기 결과, 아직 저장되지 않은 천장 상태를 담는다
 */
public class ResolutionBatch {

    private final List<ResolvedRequest> resolvedRequests = new ArrayList<>();
    private final List<GachaDraw> draws = new ArrayList<>();
    private final Map<String, PitySession> pitySessions = new LinkedHashMap<>();

    /**
     * 요청 1건의 전개 결과
     */
    public record ResolvedRequest(RewardHandler request, List<RewardHandler> rewards) {
    }

    void addResolved(RewardHandler request, List<RewardHandler> rewards) {
        resolvedRequests.add(new ResolvedRequest(request, List.copyOf(rewards)));
    }

    void addDraws(List<GachaDraw> gachaDraws) {
        draws.addAll(gachaDraws);
    }

    /**
     * 가챠 보상 행의 천장 세션 (배치 안에서 한 번만 로드)
     */
    PitySession pitySession(String rewardKey, Supplier<PitySession> loader) {
        return pitySessions.computeIfAbsent(rewardKey, key -> loader.get());
    }

    public List<ResolvedRequest> resolvedRequests() {
        return Collections.unmodifiableList(resolvedRequests);
    }

    /**
     * 전체 평탄화 보상 (요청 순서 유지)
     */
    public List<RewardHandler> rewards() {
        return resolvedRequests.stream()
                .flatMap(resolved -> resolved.rewards().stream())
                .toList();
    }

    public List<GachaDraw> draws() {
        return Collections.unmodifiableList(draws);
    }

    public Map<String, PitySession> pitySessions() {
        return Collections.unmodifiableMap(pitySessions);
    }

    public Optional<PitySession> findPitySession(String rewardKey) {
        return Optional.ofNullable(pitySessions.get(rewardKey));
    }
}
