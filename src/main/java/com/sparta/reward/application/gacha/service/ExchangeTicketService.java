package com.sparta.reward.application.gacha.service;

import com.sparta.reward.application.gacha.dto.ExchangeTicketResponse;
import com.sparta.reward.application.reward.RewardGrantService;
import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.exception.GachaCampaignNotFoundException;
import com.sparta.reward.domain.gacha.repository.GachaCampaignRepository;
import com.sparta.reward.domain.reward.AcquireSource;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 뽑기 티켓 교환 서비스
 *
 * 재화 차감과 티켓 지급을 하나의 배치로 처리한다.
 * 교환으로 받는 티켓은 슬롯 예측을 건너뛴다 (AcquireSource.EXCHANGE).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeTicketService {

    private final GachaCampaignRepository gachaCampaignRepository;
    private final RewardGrantService rewardGrantService;

    @Transactional
    public ExchangeTicketResponse exchange(String campaignKey, String accountId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("교환 수량은 1 이상이어야 합니다");
        }

        GachaCampaign campaign = gachaCampaignRepository.findById(campaignKey)
                .orElseThrow(() -> new GachaCampaignNotFoundException(campaignKey));
        if (!campaign.isExchangeable()) {
            throw new RewardConfigurationException("티켓 교환이 불가능한 캠페인입니다: " + campaignKey);
        }

        long cost = campaign.exchangeCost(amount);
        if (cost > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("교환 비용이 허용 범위를 넘었습니다: " + cost);
        }

        rewardGrantService.grant(accountId, List.of(
                RewardHandler.currency(campaign.getExchangeCurrencyKey(), (int) -cost),
                RewardHandler.item(campaign.getTicketItemKey(), amount).withSource(AcquireSource.EXCHANGE)
        ));

        log.info("티켓 교환 완료 - accountId={}, campaignKey={}, 티켓={}, 소모 재화={}",
                accountId, campaignKey, amount, cost);

        return new ExchangeTicketResponse(
                accountId,
                campaign.getTicketItemKey(),
                amount,
                campaign.getExchangeCurrencyKey(),
                cost
        );
    }
}
