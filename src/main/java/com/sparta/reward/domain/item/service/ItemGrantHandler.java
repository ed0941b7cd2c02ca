package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.exception.InvalidItemQuantityException;
import com.sparta.reward.domain.item.repository.EquipmentSlotRepository;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import com.sparta.reward.domain.item.repository.ItemTypeRepository;
import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.service.RewardGrantHandler;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 아이템 보상 지급 처리기
 * 양수는 추가, 음수는 소모 (스택 불가 아이템은 미장착 레코드부터 소모)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItemGrantHandler implements RewardGrantHandler {

    private final ItemTypeRepository itemTypeRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final EquipmentSlotRepository equipmentSlotRepository;
    private final InventoryQueryService inventoryQueryService;
    private final InventoryApplier inventoryApplier;

    @Override
    public RewardType supportedType() {
        return RewardType.ITEM;
    }

    @Override
    public boolean simulate(String accountId, RewardHandler reward) {
        if (reward.amount() == 0 || itemTypeRepository.findById(reward.typeKey()).isEmpty()) {
            return false;
        }
        if (reward.amount() > 0) {
            return true;
        }
        return inventoryQueryService.ownedAmount(accountId, reward.typeKey()) >= -reward.amount();
    }

    @Override
    public void apply(String accountId, RewardHandler reward) {
        if (reward.amount() > 0) {
            inventoryApplier.addItem(accountId, reward.typeKey(), reward.amount());
            return;
        }
        consume(accountId, reward.typeKey(), -reward.amount());
    }

    private void consume(String accountId, String itemTypeKey, int amount) {
        ItemType itemType = itemTypeRepository.findById(itemTypeKey)
                .orElseThrow(() -> new InvalidItemQuantityException("아이템 타입을 찾을 수 없습니다: " + itemTypeKey));

        if (itemType.isStackable()) {
            Optional<InventoryItem> stack = inventoryQueryService.findItemRecord(accountId, itemTypeKey);
            if (stack.isEmpty() || !inventoryApplier.removeItem(stack.get(), amount)) {
                throw new InvalidItemQuantityException(
                        String.format("아이템 수량이 부족합니다. 아이템: %s, 요청: %d", itemTypeKey, amount));
            }
            return;
        }

        List<InventoryItem> records = inventoryItemRepository
                .findByAccountIdAndItemTypeKeyOrderByCreatedAtAsc(accountId, itemTypeKey)
                .stream()
                .sorted(Comparator.comparing(item -> equipmentSlotRepository.existsByItemUid(item.getItemUid())))
                .toList();
        if (records.size() < amount) {
            throw new InvalidItemQuantityException(
                    String.format("아이템 수량이 부족합니다. 아이템: %s, 요청: %d, 보유: %d", itemTypeKey, amount, records.size()));
        }

        for (int i = 0; i < amount; i++) {
            inventoryApplier.removeItem(records.get(i), records.get(i).getAmount());
        }
        log.debug("스택 불가 아이템 소모 - accountId={}, itemTypeKey={}, amount={}", accountId, itemTypeKey, amount);
    }
}
