package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 보상 지급 처리기 매핑 테스트
 */
@DisplayName("보상 지급 처리기 매핑 테스트")
class RewardGrantRegistryTest {

    private static class RecordingHandler implements RewardGrantHandler {

        private final RewardType type;
        private final List<RewardHandler> applied = new ArrayList<>();

        RecordingHandler(RewardType type) {
            this.type = type;
        }

        @Override
        public RewardType supportedType() {
            return type;
        }

        @Override
        public boolean simulate(String accountId, RewardHandler reward) {
            return reward.amount() > 0;
        }

        @Override
        public void apply(String accountId, RewardHandler reward) {
            applied.add(reward);
        }
    }

    @Test
    @DisplayName("보상 타입에 맞는 처리기로 위임한다")
    void 타입별_위임() {
        // given
        RecordingHandler itemHandler = new RecordingHandler(RewardType.ITEM);
        RecordingHandler currencyHandler = new RecordingHandler(RewardType.CURRENCY);
        RewardGrantRegistry registry = new RewardGrantRegistry(List.of(itemHandler, currencyHandler));

        // when
        registry.applyAll("A001", List.of(RewardHandler.item("POTION", 1), RewardHandler.currency("GOLD", 10)));

        // then
        assertThat(itemHandler.applied).containsExactly(RewardHandler.item("POTION", 1));
        assertThat(currencyHandler.applied).containsExactly(RewardHandler.currency("GOLD", 10));
        assertThat(registry.simulate("A001", RewardHandler.item("POTION", -1))).isFalse();
    }

    @Test
    @DisplayName("처리기가 없는 타입은 검증에 실패하고 지급 시 설정 오류가 발생한다")
    void 처리기없음() {
        // given
        RewardGrantRegistry registry = new RewardGrantRegistry(List.of(new RecordingHandler(RewardType.ITEM)));

        // when & then
        assertThat(registry.simulate("A001", RewardHandler.rewardData("PACK", 1))).isFalse();
        assertThatThrownBy(() -> registry.apply("A001", RewardHandler.gacha("GACHA", 1)))
                .isInstanceOf(RewardConfigurationException.class);
    }

    @Test
    @DisplayName("같은 타입의 처리기가 둘이면 생성에 실패한다")
    void 중복_처리기() {
        // when & then
        assertThatThrownBy(() -> new RewardGrantRegistry(List.of(
                new RecordingHandler(RewardType.ITEM),
                new RecordingHandler(RewardType.ITEM)
        ))).isInstanceOf(IllegalStateException.class);
    }
}
