package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.item.entity.AccountInventory;
import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.repository.AccountInventoryRepository;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 인벤토리 조회 서비스 (읽기 전용)
 */
@Service
public class InventoryQueryService {

    private final InventoryItemRepository inventoryItemRepository;
    private final AccountInventoryRepository accountInventoryRepository;
    private final int defaultMaxCapacity;

    public InventoryQueryService(InventoryItemRepository inventoryItemRepository,
                                 AccountInventoryRepository accountInventoryRepository,
                                 @Value("${reward.inventory.default-max-capacity:200}") int defaultMaxCapacity) {
        this.inventoryItemRepository = inventoryItemRepository;
        this.accountInventoryRepository = accountInventoryRepository;
        this.defaultMaxCapacity = defaultMaxCapacity;
    }

    public int currentSlotCount(String accountId) {
        return Math.toIntExact(inventoryItemRepository.countOccupiedSlots(accountId));
    }

    /**
     * 최대 용량 (계정 설정이 없으면 기본값)
     */
    public int maxCapacity(String accountId) {
        return accountInventoryRepository.findById(accountId)
                .map(AccountInventory::getMaxCapacity)
                .orElse(defaultMaxCapacity);
    }

    public int ownedAmount(String accountId, String itemTypeKey) {
        return Math.toIntExact(inventoryItemRepository.sumAmount(accountId, itemTypeKey));
    }

    /**
     * 아이템 타입의 레코드 조회 (스택 아이템은 계정당 하나)
     */
    public Optional<InventoryItem> findItemRecord(String accountId, String itemTypeKey) {
        return inventoryItemRepository.findFirstByAccountIdAndItemTypeKey(accountId, itemTypeKey);
    }
}
