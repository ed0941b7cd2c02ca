package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.repository.ItemTypeRepository;
import com.sparta.reward.domain.item.vo.StagedItemChange;
import com.sparta.reward.domain.reward.AcquireSource;
import com.sparta.reward.domain.reward.service.RewardGrantRegistry;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 보상 시뮬레이션 (실제 지급 전 검증)
 *
 * 알고리즘:
 * 1. 스택 가능 아이템 병합 (합계 0이면 제거)
 * 2. 현재 인벤토리 슬롯 수 + 예정된 변경의 슬롯 영향
 * 3. 보상별 지급 검증 + 추가될 슬롯 수 예측
 * 4. 최대 용량을 넘는 즉시 중단
 *
 * 저장된 상태를 절대 변경하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventorySimulator {

    private final ItemTypeRepository itemTypeRepository;
    private final InventoryQueryService inventoryQueryService;
    private final RewardGrantRegistry rewardGrantRegistry;

    public SimulationResult simulate(String accountId,
                                     List<RewardHandler> rewards,
                                     List<StagedItemChange> stagedChanges,
                                     boolean checkInventory) {
        Map<String, Optional<ItemType>> itemTypes = new HashMap<>();
        List<RewardHandler> merged = merge(rewards, itemTypes);

        int slotAmount = inventoryQueryService.currentSlotCount(accountId);
        slotAmount += stagedSlotDelta(stagedChanges, itemTypes);
        int maxCapacity = inventoryQueryService.maxCapacity(accountId);

        for (RewardHandler reward : merged) {
            if (!rewardGrantRegistry.simulate(accountId, reward)) {
                log.warn("보상 지급 검증 실패 - accountId={}, type={}, key={}, amount={}",
                        accountId, reward.rewardType(), reward.typeKey(), reward.amount());
                return SimulationResult.rejected(reward);
            }

            if (!checkInventory || !reward.isItem() || reward.acquireSource() != AcquireSource.NONE) {
                continue;
            }

            ItemType itemType = findItemType(reward.typeKey(), itemTypes).orElse(null);
            if (itemType == null || !itemType.isRequiresSlot()) {
                continue;
            }

            int ownedAmount = inventoryQueryService.ownedAmount(accountId, reward.typeKey());
            slotAmount += predictSlotDelta(itemType, reward.amount(), ownedAmount);

            if (slotAmount > maxCapacity) {
                log.warn("인벤토리 용량 초과 - accountId={}, 예상 슬롯={}, 최대 용량={}", accountId, slotAmount, maxCapacity);
                return SimulationResult.inventoryFull(reward, slotAmount, maxCapacity);
            }
        }

        return SimulationResult.success(merged, slotAmount, maxCapacity);
    }

    /**
     * 아이템 보상 병합
     * 순서: 아이템 외 보상 → 병합된 스택 아이템 → 스택 불가 아이템
     */
    List<RewardHandler> merge(List<RewardHandler> rewards, Map<String, Optional<ItemType>> itemTypes) {
        List<RewardHandler> others = new ArrayList<>();
        List<RewardHandler> nonStackables = new ArrayList<>();
        Map<String, RewardHandler> stackables = new LinkedHashMap<>();

        for (RewardHandler reward : rewards) {
            if (!reward.isItem()) {
                others.add(reward);
                continue;
            }

            ItemType itemType = findItemType(reward.typeKey(), itemTypes).orElse(null);
            if (itemType == null) {
                // 지급 검증 단계에서 실패 처리
                others.add(reward);
                continue;
            }

            if (itemType.isStackable()) {
                stackables.merge(reward.typeKey(), reward, InventorySimulator::mergeStack);
            } else {
                nonStackables.add(reward);
            }
        }

        List<RewardHandler> merged = new ArrayList<>(others);
        stackables.values().stream()
                .filter(reward -> reward.amount() != 0)
                .forEach(merged::add);
        merged.addAll(nonStackables);
        return merged;
    }

    /**
     * 같은 스택 아이템 합산
     * 슬롯 예측 대상(NONE) 보상이 하나라도 섞이면 합산 결과도 슬롯 예측 대상이다
     */
    private static RewardHandler mergeStack(RewardHandler current, RewardHandler added) {
        RewardHandler merged = current.withAmount(current.amount() + added.amount());
        if (added.acquireSource() == AcquireSource.NONE) {
            return merged.withSource(AcquireSource.NONE);
        }
        return merged;
    }

    /**
     * 보상 1건의 슬롯 증감 예측
     */
    int predictSlotDelta(ItemType itemType, int amount, int ownedAmount) {
        if (!itemType.isStackable()) {
            if (amount > 0) {
                return amount;
            }
            return -Math.min(ownedAmount, -amount);
        }

        // 새 스택이면 +1, 기존 스택에 합쳐지면 변화 없음
        if (amount > 0) {
            return ownedAmount == 0 ? 1 : 0;
        }
        // 스택이 완전히 소진되면 -1
        if (amount < 0 && ownedAmount > 0 && ownedAmount + amount <= 0) {
            return -1;
        }
        return 0;
    }

    private int stagedSlotDelta(List<StagedItemChange> stagedChanges, Map<String, Optional<ItemType>> itemTypes) {
        int delta = 0;
        for (StagedItemChange change : stagedChanges) {
            ItemType itemType = findItemType(change.itemTypeKey(), itemTypes).orElse(null);
            if (itemType == null || !itemType.isRequiresSlot()) {
                continue;
            }

            if (!itemType.isStackable()) {
                delta += change.amountDelta();
            } else if (change.kind() == StagedItemChange.ChangeKind.CREATED) {
                delta += 1;
            } else if (change.kind() == StagedItemChange.ChangeKind.DELETED) {
                delta -= 1;
            }
        }
        return delta;
    }

    private Optional<ItemType> findItemType(String itemTypeKey, Map<String, Optional<ItemType>> itemTypes) {
        return itemTypes.computeIfAbsent(itemTypeKey, itemTypeRepository::findById);
    }
}
