package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.exception.InvalidItemQuantityException;
import com.sparta.reward.domain.item.repository.EquipmentSlotRepository;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import com.sparta.reward.domain.item.repository.ItemTypeRepository;
import com.sparta.reward.domain.item.vo.SubOption;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 인벤토리 아이템 변경 처리기
 *
 * 시뮬레이션이 성공한 배치에 대해서만 호출되며,
 * 호출자의 트랜잭션 안에서 모든 변경이 함께 커밋된다.
 *
 * 수량 변경은 모두 updateAmount()를 거쳐 [0, maxStack] 범위로 보정되고,
 * 보정 후 수량이 0이면 레코드를 삭제한다. 최대 스택을 넘는 수량은 폐기된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryApplier {

    private final InventoryItemRepository inventoryItemRepository;
    private final ItemTypeRepository itemTypeRepository;
    private final EquipmentSlotRepository equipmentSlotRepository;
    private final SubOptionRoller subOptionRoller;

    public List<InventoryItem> addItem(String accountId, String itemTypeKey, int amount) {
        return addItem(accountId, itemTypeKey, amount, List.of());
    }

    /**
     * 인벤토리 아이템 추가
     *
     * - 스택 가능 + 보유 중: 기존 레코드 수량 증가
     * - 그 외: 새 레코드 생성 (스택 불가 아이템은 수량만큼 레코드 생성)
     * - 장비 아이템은 서브 옵션 생성 (같은 인덱스의 고정 옵션이 우선)
     *
     * @return 변경되거나 생성된 레코드 목록
     */
    public List<InventoryItem> addItem(String accountId, String itemTypeKey, int amount, List<SubOption> fixedOptions) {
        if (amount <= 0) {
            throw new InvalidItemQuantityException("추가 수량은 0보다 커야 합니다: " + amount);
        }
        ItemType itemType = getItemType(itemTypeKey);

        if (itemType.isStackable()) {
            InventoryItem existing = inventoryItemRepository
                    .findFirstByAccountIdAndItemTypeKey(accountId, itemTypeKey)
                    .orElse(null);
            if (existing != null) {
                updateAmount(existing, itemType, amount);
                return List.of(existing);
            }
            return List.of(createItem(accountId, itemType, itemType.clamp(amount), fixedOptions));
        }

        List<InventoryItem> created = new ArrayList<>(amount);
        for (int i = 0; i < amount; i++) {
            created.add(createItem(accountId, itemType, 1, fixedOptions));
        }
        return created;
    }

    /**
     * 인벤토리 아이템 제거
     *
     * @return 음수 수량이거나 보유량을 넘으면 false (변경 없음)
     */
    public boolean removeItem(InventoryItem item, int removeAmount) {
        if (item == null || removeAmount < 0 || item.getAmount() - removeAmount < 0) {
            log.warn("아이템 제거 거부 - itemUid={}, 보유={}, 요청={}",
                    item == null ? null : item.getItemUid(),
                    item == null ? 0 : item.getAmount(),
                    removeAmount);
            return false;
        }

        updateAmount(item, getItemType(item.getItemTypeKey()), -removeAmount);
        return true;
    }

    /**
     * 수량 변경 단일 진입점
     * 보정 후 수량 기준으로 갱신/삭제를 결정한다
     *
     * @return 보정 후 수량
     */
    public int updateAmount(InventoryItem item, ItemType itemType, int delta) {
        int requested = item.getAmount() + delta;
        int clamped = itemType.clamp(requested);

        if (clamped != requested) {
            log.info("아이템 수량 보정 - itemUid={}, 요청={}, 보정={}, maxStack={}",
                    item.getItemUid(), requested, clamped, itemType.getMaxStack());
        }

        if (clamped > 0) {
            item.changeAmount(clamped);
            inventoryItemRepository.save(item);
        } else {
            item.changeAmount(0);
            deleteItem(item);
        }
        return clamped;
    }

    private InventoryItem createItem(String accountId, ItemType itemType, int amount, List<SubOption> fixedOptions) {
        InventoryItem item = InventoryItem.create(accountId, itemType.getItemTypeKey(), amount);
        item.replaceOptions(buildOptions(itemType, fixedOptions));
        InventoryItem saved = inventoryItemRepository.save(item);
        log.debug("아이템 생성 - accountId={}, itemTypeKey={}, amount={}, itemUid={}",
                accountId, itemType.getItemTypeKey(), amount, saved.getItemUid());
        return saved;
    }

    /**
     * 장비 서브 옵션 구성
     * 고정 옵션이 있는 인덱스는 고정 옵션을, 나머지는 새로 굴린 옵션을 사용
     */
    private List<SubOption> buildOptions(ItemType itemType, List<SubOption> fixedOptions) {
        if (!itemType.isEquipment()) {
            return List.of();
        }

        List<SubOption> rolled = subOptionRoller.roll(itemType);
        List<SubOption> options = new ArrayList<>(rolled.size());
        for (int i = 0; i < rolled.size(); i++) {
            SubOption fixed = fixedOptions != null && i < fixedOptions.size() ? fixedOptions.get(i) : null;
            options.add(fixed != null ? fixed : rolled.get(i));
        }
        return options;
    }

    /**
     * 레코드 삭제 (장착 중이면 장착 정보도 삭제)
     */
    private void deleteItem(InventoryItem item) {
        equipmentSlotRepository.findByItemUid(item.getItemUid())
                .ifPresent(slot -> {
                    equipmentSlotRepository.delete(slot);
                    log.info("장착 정보 삭제 - itemUid={}, slotKey={}", item.getItemUid(), slot.getSlotKey());
                });
        inventoryItemRepository.delete(item);
        log.debug("아이템 삭제 - itemUid={}", item.getItemUid());
    }

    private ItemType getItemType(String itemTypeKey) {
        return itemTypeRepository.findById(itemTypeKey)
                .orElseThrow(() -> new RewardConfigurationException("아이템 타입을 찾을 수 없습니다: " + itemTypeKey));
    }
}
