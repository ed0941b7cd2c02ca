package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.entity.PityCounter;
import com.sparta.reward.domain.gacha.repository.GachaCampaignRepository;
import com.sparta.reward.domain.gacha.repository.PityCounterRepository;
import com.sparta.reward.domain.gacha.service.GachaDrawer;
import com.sparta.reward.domain.gacha.vo.GachaDraw;
import com.sparta.reward.domain.gacha.vo.PitySession;
import com.sparta.reward.domain.reward.entity.RewardTable;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.repository.RewardTableRepository;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 보상 요청 전개기
 *
 * - GACHA: 천장 카운터를 로드해 amount 회 뽑은 뒤 결과를 전개
 * - REWARD_DATA: 참조 행을 amount 회 전개 (행 안의 GACHA도 같은 천장 상태로 추첨)
 * - 그 외: 그대로 전달
 *
 * 상태를 저장하지 않는다. 천장 상태는 ResolutionBatch에 담겨 호출자가 저장한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardResolver {

    private final RewardTableRepository rewardTableRepository;
    private final GachaCampaignRepository gachaCampaignRepository;
    private final PityCounterRepository pityCounterRepository;
    private final GachaDrawer gachaDrawer;
    private final RewardExpander rewardExpander;

    public ResolutionBatch resolve(String accountId, List<RewardHandler> requests) {
        ResolutionBatch batch = new ResolutionBatch();
        for (RewardHandler request : requests) {
            if (request == null || request.isNone()) {
                continue;
            }
            batch.addResolved(request, resolveOne(accountId, request, batch));
        }
        return batch;
    }

    private List<RewardHandler> resolveOne(String accountId, RewardHandler request, ResolutionBatch batch) {
        NestedGachaDrawer nestedGacha = gacha -> drawGacha(accountId, gacha, batch);
        return switch (request.rewardType()) {
            case GACHA -> rewardExpander.expandAll(drawGacha(accountId, request, batch), nestedGacha);
            case REWARD_DATA -> resolveRewardData(request, nestedGacha);
            default -> List.of(request);
        };
    }

    /**
     * 가챠 행에서 amount 회 뽑는다 (전개 전 결과)
     * 요청 최상위의 GACHA와 보상 테이블 안의 GACHA가 같은 배치 천장 상태를 공유한다
     */
    private List<RewardHandler> drawGacha(String accountId, RewardHandler gacha, ResolutionBatch batch) {
        RewardTable row = findRow(gacha.typeKey());
        GachaCampaign campaign = gachaCampaignRepository.findFirstByRewardGroupKey(row.getRewardGroupKey())
                .orElseThrow(() -> new RewardConfigurationException(
                        "가챠 캠페인 설정을 찾을 수 없습니다: " + row.getRewardGroupKey()));

        PitySession session = batch.pitySession(gacha.typeKey(), () -> loadPitySession(accountId, gacha.typeKey()));
        List<GachaDraw> draws = gachaDrawer.draw(row, campaign, session.state(), gacha.amount());
        batch.addDraws(draws);

        log.info("[Reward_Gacha] accountId={}, rewardKey={}, count={}, Normal: {}/{}, Special: {}/{}",
                accountId, gacha.typeKey(), gacha.amount(),
                session.state().getNormal(), GachaCampaign.NORMAL_TRY_COUNT,
                session.state().getSpecial(), campaign.getSpecialTryCount());

        return draws.stream().map(GachaDraw::reward).toList();
    }

    private List<RewardHandler> resolveRewardData(RewardHandler request, NestedGachaDrawer nestedGacha) {
        if (request.amount() <= 0) {
            throw new IllegalArgumentException("보상 반복 횟수는 1 이상이어야 합니다");
        }
        RewardTable row = findRow(request.typeKey());

        List<RewardHandler> rewards = new ArrayList<>();
        for (int i = 0; i < request.amount(); i++) {
            rewards.addAll(rewardExpander.expand(row, nestedGacha));
        }
        return rewards;
    }

    private PitySession loadPitySession(String accountId, String rewardKey) {
        PityCounter counter = pityCounterRepository.findByAccountIdAndRewardKey(accountId, rewardKey)
                .orElseGet(() -> PityCounter.start(accountId, rewardKey));
        return PitySession.of(counter);
    }

    private RewardTable findRow(String rewardKey) {
        return rewardTableRepository.findById(rewardKey)
                .orElseThrow(() -> new RewardConfigurationException("보상 테이블을 찾을 수 없습니다: " + rewardKey));
    }
}
