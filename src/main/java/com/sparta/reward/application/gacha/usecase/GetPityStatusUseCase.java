package com.sparta.reward.application.gacha.usecase;

import com.sparta.reward.application.gacha.dto.PityStatusResponse;
import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.entity.PityCounter;
import com.sparta.reward.domain.gacha.exception.GachaCampaignNotFoundException;
import com.sparta.reward.domain.gacha.repository.GachaCampaignRepository;
import com.sparta.reward.domain.gacha.repository.PityCounterRepository;
import com.sparta.reward.domain.gacha.vo.PityState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 천장 진행 상황 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetPityStatusUseCase {

    private final GachaCampaignRepository gachaCampaignRepository;
    private final PityCounterRepository pityCounterRepository;

    /**
     * 카운터가 없으면 (한 번도 뽑지 않았으면) 0/0 으로 응답
     */
    @Transactional(readOnly = true)
    public PityStatusResponse execute(String campaignKey, String accountId) {
        GachaCampaign campaign = gachaCampaignRepository.findById(campaignKey)
                .orElseThrow(() -> new GachaCampaignNotFoundException(campaignKey));

        PityState state = pityCounterRepository
                .findByAccountIdAndRewardKey(accountId, campaign.getRewardKey())
                .map(PityCounter::toState)
                .orElseGet(() -> new PityState(0, 0));

        return PityStatusResponse.of(campaign, state);
    }
}
