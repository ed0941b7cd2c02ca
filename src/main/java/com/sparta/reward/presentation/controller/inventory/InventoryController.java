package com.sparta.reward.presentation.controller.inventory;

import com.sparta.reward.application.inventory.dto.DismantleItemRequest;
import com.sparta.reward.application.inventory.dto.DismantleItemResponse;
import com.sparta.reward.application.inventory.dto.InventoryResponse;
import com.sparta.reward.application.inventory.usecase.DismantleItemUseCase;
import com.sparta.reward.application.inventory.usecase.GetInventoryUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 인벤토리 API
 */
@Tag(name = "인벤토리", description = "인벤토리 조회 및 아이템 분해 API")
@Validated
@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final GetInventoryUseCase getInventoryUseCase;
    private final DismantleItemUseCase dismantleItemUseCase;

    @Operation(summary = "인벤토리 조회", description = "보유 아이템 목록과 슬롯 사용량을 조회합니다")
    @GetMapping
    public ResponseEntity<InventoryResponse> getInventory(
            @Parameter(description = "계정 ID") @RequestParam @NotBlank(message = "계정 ID는 필수입니다") String accountId) {
        return ResponseEntity.ok(getInventoryUseCase.execute(accountId));
    }

    /**
     * 아이템 분해
     * POST /api/inventory/{itemUid}/dismantle
     */
    @Operation(summary = "아이템 분해", description = "아이템 레코드를 제거하고 분해 보상을 지급합니다")
    @PostMapping("/{itemUid}/dismantle")
    public ResponseEntity<DismantleItemResponse> dismantle(
            @Parameter(description = "아이템 UID") @PathVariable String itemUid,
            @Valid @RequestBody DismantleItemRequest request) {
        DismantleItemResponse response = dismantleItemUseCase.execute(itemUid, request);
        return ResponseEntity.ok(response);
    }
}
