package com.sparta.reward.domain.gacha.repository;

import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * 가챠 캠페인 저장소
 */
public interface GachaCampaignRepository extends JpaRepository<GachaCampaign, String> {

    Optional<GachaCampaign> findFirstByRewardGroupKey(String rewardGroupKey);
}
