package com.sparta.reward.application.gacha.service;

import com.sparta.reward.application.gacha.dto.GachaDrawResponse;
import com.sparta.reward.application.gacha.dto.PityStatusResponse;
import com.sparta.reward.application.gacha.dto.RewardResponse;
import com.sparta.reward.application.reward.RewardGrantResult;
import com.sparta.reward.application.reward.RewardGrantService;
import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.exception.GachaCampaignNotFoundException;
import com.sparta.reward.domain.gacha.repository.GachaCampaignRepository;
import com.sparta.reward.domain.gacha.vo.PityState;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 가챠 뽑기 트랜잭션 처리 서비스
 * DrawGachaUseCase에서 분산 락 획득 후 호출됨
 *
 * 티켓 소모와 뽑기 보상을 하나의 배치로 시뮬레이션/지급한다.
 * 티켓이 부족하거나 인벤토리가 가득 차면 티켓도 소모되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrawGachaService {

    private final GachaCampaignRepository gachaCampaignRepository;
    private final RewardGrantService rewardGrantService;

    @Transactional
    public GachaDrawResponse draw(String campaignKey, String accountId, int drawCount) {
        GachaCampaign campaign = gachaCampaignRepository.findById(campaignKey)
                .orElseThrow(() -> new GachaCampaignNotFoundException(campaignKey));

        List<RewardHandler> requests = new ArrayList<>();
        if (campaign.usesTicket()) {
            requests.add(RewardHandler.item(campaign.getTicketItemKey(), -drawCount));
        }
        requests.add(RewardHandler.gacha(campaign.getRewardKey(), drawCount));

        RewardGrantResult result = rewardGrantService.grant(accountId, requests);

        PityState pityState = result.pityStates().get(campaign.getRewardKey());
        List<RewardResponse> rewards = result.rewards().stream()
                .filter(reward -> !reward.isConsumption())
                .map(RewardResponse::from)
                .toList();

        log.info("가챠 뽑기 완료 - accountId={}, campaignKey={}, count={}, highGrade={}",
                accountId, campaignKey, drawCount, result.hasHighGrade());

        return new GachaDrawResponse(
                accountId,
                drawCount,
                rewards,
                result.hasHighGrade(),
                PityStatusResponse.of(campaign, pityState)
        );
    }
}
