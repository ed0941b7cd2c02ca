package com.sparta.reward.domain.gacha.entity;

import com.sparta.reward.domain.gacha.vo.PityState;
import com.sparta.reward.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 계정별 가챠 천장 카운터
 * (계정, 가챠 보상 행 키) 단위로 첫 뽑기 시 생성되며 만료되지 않는다
 * 같은 행을 뽑는 캠페인끼리는 천장을 공유한다
 */
@Entity
@Table(name = "pity_counters", uniqueConstraints = {
        @UniqueConstraint(name = "uk_pity_counters_account_reward", columnNames = {"account_id", "reward_key"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PityCounter extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String pityCounterId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "reward_key", nullable = false)
    private String rewardKey;

    @Column(name = "normal_counter", nullable = false)
    private int normalCounter;

    @Column(name = "special_counter", nullable = false)
    private int specialCounter;

    @Version
    private Long version;

    /**
     * 첫 뽑기용 카운터 생성
     */
    public static PityCounter start(String accountId, String rewardKey) {
        return PityCounter.builder()
                .accountId(accountId)
                .rewardKey(rewardKey)
                .normalCounter(0)
                .specialCounter(0)
                .build();
    }

    /**
     * 배치 시작 시 메모리 상태로 복사
     */
    public PityState toState() {
        return new PityState(normalCounter, specialCounter);
    }

    /**
     * 배치 종료 시 메모리 상태 반영
     */
    public void apply(PityState state) {
        this.normalCounter = state.getNormal();
        this.specialCounter = state.getSpecial();
    }
}
