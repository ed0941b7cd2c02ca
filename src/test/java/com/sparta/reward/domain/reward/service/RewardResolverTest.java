package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.entity.PityCounter;
import com.sparta.reward.domain.gacha.repository.GachaCampaignRepository;
import com.sparta.reward.domain.gacha.repository.PityCounterRepository;
import com.sparta.reward.domain.gacha.service.GachaDrawer;
import com.sparta.reward.domain.reward.entity.RewardTable;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.repository.RewardTableRepository;
import com.sparta.reward.domain.reward.vo.RewardCandidate;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import com.sparta.reward.support.FixedRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * 보상 요청 전개기 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("보상 요청 전개기 테스트")
class RewardResolverTest {

    private static final String ACCOUNT_ID = "A001";

    // 가챠 후보: 보상팩(복합) 1개
    private static final RewardTable GACHA_ROW = RewardTable.of("GACHA_WEAPON", "GACHA_WEAPON", List.of(), List.of(
            new RewardCandidate(RewardHandler.rewardData("WEAPON_PACK", 1), 100, 1)
    ));
    private static final RewardTable WEAPON_PACK = RewardTable.of("WEAPON_PACK", "PACK", List.of(
            RewardHandler.item("SWORD", 1),
            RewardHandler.currency("GOLD", 10)
    ), List.of());
    private static final GachaCampaign CAMPAIGN = GachaCampaign.builder()
            .campaignKey("CAMPAIGN_WEAPON")
            .rewardKey("GACHA_WEAPON")
            .rewardGroupKey("GACHA_WEAPON")
            .normalPickupGroup(2)
            .specialPickupGroup(3)
            .specialTryCount(80)
            .build();

    @Mock
    private RewardTableRepository rewardTableRepository;

    @Mock
    private GachaCampaignRepository gachaCampaignRepository;

    @Mock
    private PityCounterRepository pityCounterRepository;

    private RewardResolver rewardResolver;

    @BeforeEach
    void setUp() {
        WeightedSelector selector = new WeightedSelector(new FixedRandom(0));
        rewardResolver = new RewardResolver(
                rewardTableRepository,
                gachaCampaignRepository,
                pityCounterRepository,
                new GachaDrawer(selector),
                new RewardExpander(rewardTableRepository, selector, 16)
        );
    }

    @Test
    @DisplayName("가챠 요청은 뽑기 결과를 전개하고 같은 배치에서 천장 카운터를 한 번만 로드한다")
    void 가챠_요청_전개() {
        // given
        given(rewardTableRepository.findById("GACHA_WEAPON")).willReturn(Optional.of(GACHA_ROW));
        given(rewardTableRepository.findById("WEAPON_PACK")).willReturn(Optional.of(WEAPON_PACK));
        given(gachaCampaignRepository.findFirstByRewardGroupKey("GACHA_WEAPON")).willReturn(Optional.of(CAMPAIGN));
        given(pityCounterRepository.findByAccountIdAndRewardKey(ACCOUNT_ID, "GACHA_WEAPON"))
                .willReturn(Optional.of(PityCounter.start(ACCOUNT_ID, "GACHA_WEAPON")));

        // when
        ResolutionBatch batch = rewardResolver.resolve(ACCOUNT_ID, List.of(
                RewardHandler.gacha("GACHA_WEAPON", 1),
                RewardHandler.gacha("GACHA_WEAPON", 2)
        ));

        // then
        assertThat(batch.draws()).hasSize(3);
        assertThat(batch.rewards()).hasSize(6)
                .containsExactly(
                        RewardHandler.item("SWORD", 1), RewardHandler.currency("GOLD", 10),
                        RewardHandler.item("SWORD", 1), RewardHandler.currency("GOLD", 10),
                        RewardHandler.item("SWORD", 1), RewardHandler.currency("GOLD", 10)
                );
        assertThat(batch.findPitySession("GACHA_WEAPON"))
                .hasValueSatisfying(session -> assertThat(session.state().getSpecial()).isEqualTo(3));
        verify(pityCounterRepository, times(1)).findByAccountIdAndRewardKey(ACCOUNT_ID, "GACHA_WEAPON");
    }

    @Test
    @DisplayName("천장 카운터가 없으면 0에서 시작한다")
    void 첫뽑기_카운터생성() {
        // given
        given(rewardTableRepository.findById("GACHA_WEAPON")).willReturn(Optional.of(GACHA_ROW));
        given(rewardTableRepository.findById("WEAPON_PACK")).willReturn(Optional.of(WEAPON_PACK));
        given(gachaCampaignRepository.findFirstByRewardGroupKey("GACHA_WEAPON")).willReturn(Optional.of(CAMPAIGN));
        given(pityCounterRepository.findByAccountIdAndRewardKey(ACCOUNT_ID, "GACHA_WEAPON"))
                .willReturn(Optional.empty());

        // when
        ResolutionBatch batch = rewardResolver.resolve(ACCOUNT_ID, List.of(RewardHandler.gacha("GACHA_WEAPON", 1)));

        // then
        assertThat(batch.pitySessions().get("GACHA_WEAPON").counter().getAccountId()).isEqualTo(ACCOUNT_ID);
        assertThat(batch.pitySessions().get("GACHA_WEAPON").state().getNormal()).isEqualTo(1);
    }

    @Test
    @DisplayName("REWARD_DATA 요청은 amount 회 전개되고 원자 보상은 그대로 전달된다")
    void 보상테이블_요청_전개() {
        // given
        given(rewardTableRepository.findById("WEAPON_PACK")).willReturn(Optional.of(WEAPON_PACK));

        // when
        ResolutionBatch batch = rewardResolver.resolve(ACCOUNT_ID, List.of(
                RewardHandler.rewardData("WEAPON_PACK", 2),
                RewardHandler.currency("GEM", -100)
        ));

        // then
        assertThat(batch.resolvedRequests()).hasSize(2);
        assertThat(batch.resolvedRequests().get(0).rewards()).hasSize(4);
        assertThat(batch.resolvedRequests().get(1).rewards()).containsExactly(RewardHandler.currency("GEM", -100));
        assertThat(batch.pitySessions()).isEmpty();
        verifyNoInteractions(pityCounterRepository);
    }

    @Test
    @DisplayName("가챠 행에 연결된 캠페인이 없으면 설정 오류다")
    void 캠페인없음_설정오류() {
        // given
        given(rewardTableRepository.findById("GACHA_WEAPON")).willReturn(Optional.of(GACHA_ROW));
        given(gachaCampaignRepository.findFirstByRewardGroupKey("GACHA_WEAPON")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> rewardResolver.resolve(ACCOUNT_ID, List.of(RewardHandler.gacha("GACHA_WEAPON", 1))))
                .isInstanceOf(RewardConfigurationException.class);
    }

    @Test
    @DisplayName("보상팩 안의 가챠는 요청 최상위 가챠와 같은 천장 상태로 추첨된다")
    void 보상팩_안의_가챠_천장공유() {
        // given
        RewardTable bundle = RewardTable.of("GACHA_BUNDLE", "BUNDLE",
                List.of(RewardHandler.gacha("GACHA_WEAPON", 2)), List.of());
        given(rewardTableRepository.findById("GACHA_BUNDLE")).willReturn(Optional.of(bundle));
        given(rewardTableRepository.findById("GACHA_WEAPON")).willReturn(Optional.of(GACHA_ROW));
        given(rewardTableRepository.findById("WEAPON_PACK")).willReturn(Optional.of(WEAPON_PACK));
        given(gachaCampaignRepository.findFirstByRewardGroupKey("GACHA_WEAPON")).willReturn(Optional.of(CAMPAIGN));
        given(pityCounterRepository.findByAccountIdAndRewardKey(ACCOUNT_ID, "GACHA_WEAPON"))
                .willReturn(Optional.of(PityCounter.start(ACCOUNT_ID, "GACHA_WEAPON")));

        // when
        ResolutionBatch batch = rewardResolver.resolve(ACCOUNT_ID, List.of(
                RewardHandler.gacha("GACHA_WEAPON", 1),
                RewardHandler.rewardData("GACHA_BUNDLE", 1)
        ));

        // then
        assertThat(batch.draws()).hasSize(3);
        assertThat(batch.resolvedRequests().get(1).rewards()).containsExactly(
                RewardHandler.item("SWORD", 1), RewardHandler.currency("GOLD", 10),
                RewardHandler.item("SWORD", 1), RewardHandler.currency("GOLD", 10)
        );
        assertThat(batch.findPitySession("GACHA_WEAPON"))
                .hasValueSatisfying(session -> assertThat(session.state().getSpecial()).isEqualTo(3));
        verify(pityCounterRepository, times(1)).findByAccountIdAndRewardKey(ACCOUNT_ID, "GACHA_WEAPON");
    }

    @Test
    @DisplayName("가챠에서 뽑힌 보상팩이 아무것도 남기지 않으면 설정 오류다")
    void 빈_보상팩_추첨_설정오류() {
        // given
        RewardTable emptyGacha = RewardTable.of("GACHA_EMPTY", "GACHA_EMPTY", List.of(), List.of(
                new RewardCandidate(RewardHandler.rewardData("EMPTY_PACK", 1), 100, 1)
        ));
        RewardTable emptyPack = RewardTable.of("EMPTY_PACK", "PACK", List.of(RewardHandler.none()), List.of());
        given(rewardTableRepository.findById("GACHA_EMPTY")).willReturn(Optional.of(emptyGacha));
        given(rewardTableRepository.findById("EMPTY_PACK")).willReturn(Optional.of(emptyPack));
        given(gachaCampaignRepository.findFirstByRewardGroupKey("GACHA_EMPTY")).willReturn(Optional.of(CAMPAIGN));
        given(pityCounterRepository.findByAccountIdAndRewardKey(ACCOUNT_ID, "GACHA_EMPTY"))
                .willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> rewardResolver.resolve(ACCOUNT_ID, List.of(RewardHandler.gacha("GACHA_EMPTY", 1))))
                .isInstanceOf(RewardConfigurationException.class);
    }
}
