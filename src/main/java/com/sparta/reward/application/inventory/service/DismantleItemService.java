package com.sparta.reward.application.inventory.service;

import com.sparta.reward.application.gacha.dto.RewardResponse;
import com.sparta.reward.application.inventory.dto.DismantleItemResponse;
import com.sparta.reward.application.reward.RewardGrantResult;
import com.sparta.reward.application.reward.RewardGrantService;
import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.exception.InvalidItemQuantityException;
import com.sparta.reward.domain.item.exception.InventoryItemNotFoundException;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import com.sparta.reward.domain.item.repository.ItemTypeRepository;
import com.sparta.reward.domain.item.service.InventoryApplier;
import com.sparta.reward.domain.item.vo.StagedItemChange;
import com.sparta.reward.domain.reward.exception.RewardConfigurationException;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 아이템 분해 트랜잭션 처리 서비스
 *
 * 처리 순서:
 * 1. 아이템 레코드 조회 + 소유자 확인
 * 2. 레코드 제거를 예정 변경으로 넘겨 분해 보상 시뮬레이션/지급 (수량만큼 반복)
 * 3. 레코드 제거
 *
 * 인벤토리가 가득 차 있어도 분해로 비워지는 슬롯을 반영해 판단한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DismantleItemService {

    private final InventoryItemRepository inventoryItemRepository;
    private final ItemTypeRepository itemTypeRepository;
    private final InventoryApplier inventoryApplier;
    private final RewardGrantService rewardGrantService;

    @Transactional
    public DismantleItemResponse dismantle(String accountId, String itemUid) {
        InventoryItem item = inventoryItemRepository.findById(itemUid)
                .filter(found -> found.isOwnedBy(accountId))
                .orElseThrow(() -> new InventoryItemNotFoundException(itemUid));

        ItemType itemType = itemTypeRepository.findById(item.getItemTypeKey())
                .orElseThrow(() -> new RewardConfigurationException("아이템 타입을 찾을 수 없습니다: " + item.getItemTypeKey()));
        if (!itemType.isDismantlable()) {
            throw new RewardConfigurationException("분해할 수 없는 아이템입니다: " + item.getItemTypeKey());
        }

        int amount = item.getAmount();
        RewardGrantResult result = rewardGrantService.grant(
                accountId,
                List.of(RewardHandler.rewardData(itemType.getDismantleRewardKey(), amount)),
                List.of(StagedItemChange.removalOf(item))
        );

        if (!inventoryApplier.removeItem(item, amount)) {
            throw new InvalidItemQuantityException("분해 대상 아이템을 제거할 수 없습니다: " + itemUid);
        }

        log.info("아이템 분해 완료 - accountId={}, itemUid={}, itemTypeKey={}, amount={}",
                accountId, itemUid, item.getItemTypeKey(), amount);

        return new DismantleItemResponse(
                itemUid,
                item.getItemTypeKey(),
                amount,
                result.rewards().stream().map(RewardResponse::from).toList()
        );
    }
}
