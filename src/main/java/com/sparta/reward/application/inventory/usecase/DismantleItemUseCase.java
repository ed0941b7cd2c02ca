package com.sparta.reward.application.inventory.usecase;

import com.sparta.reward.application.inventory.dto.DismantleItemRequest;
import com.sparta.reward.application.inventory.dto.DismantleItemResponse;
import com.sparta.reward.application.inventory.service.DismantleItemService;
import com.sparta.reward.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 아이템 분해 유스케이스
 * 락 키: "lock:reward:account:{accountId}"
 */
@Service
@RequiredArgsConstructor
public class DismantleItemUseCase {

    private final DismantleItemService dismantleItemService;

    @DistributedLock(key = "'reward:account:' + #request.accountId()")
    public DismantleItemResponse execute(String itemUid, DismantleItemRequest request) {
        return dismantleItemService.dismantle(request.accountId(), itemUid);
    }
}
