package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.reward.vo.RewardHandler;

import java.util.List;

/**
 * 보상 시뮬레이션 결과
 *
 * @param mergedRewards 병합된 보상 목록 (성공 시 지급 대상)
 * @param failure 실패 사유 (성공이면 null)
 * @param failedReward 실패를 일으킨 보상
 * @param predictedSlots 예상 점유 슬롯 수
 * @param maxCapacity 최대 용량
 */
public record SimulationResult(
        List<RewardHandler> mergedRewards,
        Failure failure,
        RewardHandler failedReward,
        int predictedSlots,
        int maxCapacity
) {

    public enum Failure {
        INVENTORY_FULL,
        GRANT_REJECTED
    }

    public static SimulationResult success(List<RewardHandler> mergedRewards, int predictedSlots, int maxCapacity) {
        return new SimulationResult(List.copyOf(mergedRewards), null, null, predictedSlots, maxCapacity);
    }

    public static SimulationResult inventoryFull(RewardHandler reward, int predictedSlots, int maxCapacity) {
        return new SimulationResult(List.of(), Failure.INVENTORY_FULL, reward, predictedSlots, maxCapacity);
    }

    public static SimulationResult rejected(RewardHandler reward) {
        return new SimulationResult(List.of(), Failure.GRANT_REJECTED, reward, 0, 0);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
