package com.sparta.reward.domain.reward.service;

import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 보상 타입 → 지급 처리기 매핑
 * 전개가 끝난 원자 보상(아이템, 재화, 캐릭터)만 처리한다
 */
@Slf4j
@Component
public class RewardGrantRegistry {

    private final Map<RewardType, RewardGrantHandler> handlers = new EnumMap<>(RewardType.class);

    public RewardGrantRegistry(List<RewardGrantHandler> grantHandlers) {
        for (RewardGrantHandler handler : grantHandlers) {
            if (handlers.putIfAbsent(handler.supportedType(), handler) != null) {
                throw new IllegalStateException("중복된 보상 처리기: " + handler.supportedType());
            }
        }
    }

    /**
     * 개별 보상 지급 가능 여부
     * 처리기가 없는 타입(NONE, REWARD_DATA, GACHA)은 항상 실패
     */
    public boolean simulate(String accountId, RewardHandler reward) {
        RewardGrantHandler handler = handlers.get(reward.rewardType());
        if (handler == null) {
            log.warn("지급 처리기가 없는 보상 - type={}, key={}", reward.rewardType(), reward.typeKey());
            return false;
        }
        return handler.simulate(accountId, reward);
    }

    public void apply(String accountId, RewardHandler reward) {
        RewardGrantHandler handler = handlers.get(reward.rewardType());
        if (handler == null) {
            throw new RewardConfigurationException("지급할 수 없는 보상 타입입니다: " + reward.rewardType());
        }
        handler.apply(accountId, reward);
    }

    public void applyAll(String accountId, List<RewardHandler> rewards) {
        for (RewardHandler reward : rewards) {
            apply(accountId, reward);
        }
    }
}
