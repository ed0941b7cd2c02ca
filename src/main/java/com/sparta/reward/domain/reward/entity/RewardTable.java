package com.sparta.reward.domain.reward.entity;

import com.sparta.reward.domain.reward.vo.RewardCandidate;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 보상 테이블 행 (정적 설정 데이터)
 *
 * - statics: 항상 지급되는 고정 보상
 * - randoms: 가중치 기반으로 하나가 추첨되는 후보 목록
 * - totalWeight: randoms 가중치 합 (행 생성 시 계산)
 */
@Entity
@Table(name = "reward_tables", indexes = {
        @Index(name = "idx_reward_tables_group", columnList = "reward_group_key")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class RewardTable {

    @Id
    @Column(name = "reward_key")
    private String rewardKey;

    @Column(name = "reward_group_key")
    private String rewardGroupKey;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reward_table_statics", joinColumns = @JoinColumn(name = "reward_key"))
    @OrderColumn(name = "seq")
    private List<RewardHandler> statics = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reward_table_randoms", joinColumns = @JoinColumn(name = "reward_key"))
    @OrderColumn(name = "seq")
    private List<RewardCandidate> randoms = new ArrayList<>();

    @Column(name = "total_weight", nullable = false)
    private int totalWeight;

    /**
     * 보상 테이블 행 생성 (totalWeight 자동 계산)
     */
    public static RewardTable of(String rewardKey, String rewardGroupKey,
                                 List<RewardHandler> statics, List<RewardCandidate> randoms) {
        return RewardTable.builder()
                .rewardKey(rewardKey)
                .rewardGroupKey(rewardGroupKey)
                .statics(new ArrayList<>(statics))
                .randoms(new ArrayList<>(randoms))
                .totalWeight(randoms.stream().mapToInt(RewardCandidate::weight).sum())
                .build();
    }

    public boolean hasRandoms() {
        return !randoms.isEmpty();
    }
}
