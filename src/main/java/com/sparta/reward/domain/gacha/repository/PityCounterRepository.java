package com.sparta.reward.domain.gacha.repository;

import com.sparta.reward.domain.gacha.entity.PityCounter;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * 천장 카운터 저장소
 */
public interface PityCounterRepository extends JpaRepository<PityCounter, String> {

    Optional<PityCounter> findByAccountIdAndRewardKey(String accountId, String rewardKey);
}
