package com.sparta.reward.application.inventory.usecase;

import com.sparta.reward.application.inventory.dto.InventoryItemResponse;
import com.sparta.reward.application.inventory.dto.InventoryResponse;
import com.sparta.reward.domain.item.entity.EquipmentSlot;
import com.sparta.reward.domain.item.repository.EquipmentSlotRepository;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import com.sparta.reward.domain.item.service.InventoryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 인벤토리 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetInventoryUseCase {

    private final InventoryItemRepository inventoryItemRepository;
    private final EquipmentSlotRepository equipmentSlotRepository;
    private final InventoryQueryService inventoryQueryService;

    @Transactional(readOnly = true)
    public InventoryResponse execute(String accountId) {
        Set<String> equippedItemUids = equipmentSlotRepository.findByAccountId(accountId).stream()
                .map(EquipmentSlot::getItemUid)
                .collect(Collectors.toSet());

        List<InventoryItemResponse> items = inventoryItemRepository.findByAccountIdOrderByCreatedAtAsc(accountId).stream()
                .map(item -> InventoryItemResponse.from(item, equippedItemUids.contains(item.getItemUid())))
                .toList();

        return new InventoryResponse(
                accountId,
                inventoryQueryService.currentSlotCount(accountId),
                inventoryQueryService.maxCapacity(accountId),
                items
        );
    }
}
