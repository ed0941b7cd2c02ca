package com.sparta.reward.application.gacha;

import com.sparta.reward.application.gacha.dto.GachaDrawResponse;
import com.sparta.reward.application.gacha.service.DrawGachaService;
import com.sparta.reward.application.reward.RewardGrantResult;
import com.sparta.reward.application.reward.RewardGrantService;
import com.sparta.reward.domain.gacha.entity.GachaCampaign;
import com.sparta.reward.domain.gacha.exception.GachaCampaignNotFoundException;
import com.sparta.reward.domain.gacha.repository.GachaCampaignRepository;
import com.sparta.reward.domain.gacha.vo.DrawMode;
import com.sparta.reward.domain.gacha.vo.GachaDraw;
import com.sparta.reward.domain.gacha.vo.PityState;
import com.sparta.reward.domain.item.exception.InventoryFullException;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 가챠 뽑기 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("가챠 뽑기 서비스 테스트")
class DrawGachaServiceTest {

    private static final String ACCOUNT_ID = "A001";

    private static final GachaCampaign CAMPAIGN = GachaCampaign.builder()
            .campaignKey("CAMPAIGN_WEAPON")
            .rewardKey("GACHA_WEAPON")
            .rewardGroupKey("GACHA_WEAPON")
            .normalPickupGroup(2)
            .specialPickupGroup(3)
            .specialTryCount(80)
            .ticketItemKey("TICKET")
            .exchangeCurrencyKey("GEM")
            .exchangePrice(160)
            .build();

    @Mock
    private GachaCampaignRepository gachaCampaignRepository;

    @Mock
    private RewardGrantService rewardGrantService;

    @InjectMocks
    private DrawGachaService drawGachaService;

    @Test
    @DisplayName("티켓 소모와 가챠 보상을 한 배치로 지급하고 남은 천장 횟수를 응답한다")
    void 뽑기_성공() {
        // given
        given(gachaCampaignRepository.findById("CAMPAIGN_WEAPON")).willReturn(Optional.of(CAMPAIGN));
        List<RewardHandler> expectedRequests = List.of(
                RewardHandler.item("TICKET", -2),
                RewardHandler.gacha("GACHA_WEAPON", 2)
        );
        RewardGrantResult result = new RewardGrantResult(
                List.of(RewardHandler.item("TICKET", -2), RewardHandler.item("SWORD_SSR", 1), RewardHandler.item("SWORD_R", 1)),
                List.of(
                        new GachaDraw(RewardHandler.item("SWORD_SSR", 1), 3, DrawMode.RANDOM, true),
                        new GachaDraw(RewardHandler.item("SWORD_R", 1), 2, DrawMode.RANDOM, false)
                ),
                Map.of("GACHA_WEAPON", new PityState(0, 1))
        );
        given(rewardGrantService.grant(ACCOUNT_ID, expectedRequests)).willReturn(result);

        // when
        GachaDrawResponse response = drawGachaService.draw("CAMPAIGN_WEAPON", ACCOUNT_ID, 2);

        // then
        assertThat(response.rewards()).hasSize(2)
                .noneMatch(reward -> reward.typeKey().equals("TICKET"));
        assertThat(response.highGrade()).isTrue();
        assertThat(response.pity().remainingToNormal()).isEqualTo(10);
        assertThat(response.pity().remainingToSpecial()).isEqualTo(79);
    }

    @Test
    @DisplayName("존재하지 않는 캠페인이면 예외가 발생한다")
    void 캠페인없음_예외() {
        // given
        given(gachaCampaignRepository.findById("INVALID")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> drawGachaService.draw("INVALID", ACCOUNT_ID, 1))
                .isInstanceOf(GachaCampaignNotFoundException.class);
        verify(rewardGrantService, never()).grant(any(), any());
    }

    @Test
    @DisplayName("인벤토리가 가득 차면 예외가 그대로 전파된다")
    void 인벤토리가득_예외전파() {
        // given
        given(gachaCampaignRepository.findById("CAMPAIGN_WEAPON")).willReturn(Optional.of(CAMPAIGN));
        given(rewardGrantService.grant(any(), any())).willThrow(new InventoryFullException(201, 200));

        // when & then
        assertThatThrownBy(() -> drawGachaService.draw("CAMPAIGN_WEAPON", ACCOUNT_ID, 10))
                .isInstanceOf(InventoryFullException.class);
    }
}
