package com.sparta.reward.presentation.controller.gacha;

import com.sparta.reward.application.gacha.dto.DrawGachaRequest;
import com.sparta.reward.application.gacha.dto.ExchangeTicketRequest;
import com.sparta.reward.application.gacha.dto.ExchangeTicketResponse;
import com.sparta.reward.application.gacha.dto.GachaDrawResponse;
import com.sparta.reward.application.gacha.dto.PityStatusResponse;
import com.sparta.reward.application.gacha.usecase.DrawGachaUseCase;
import com.sparta.reward.application.gacha.usecase.ExchangeGachaTicketUseCase;
import com.sparta.reward.application.gacha.usecase.GetPityStatusUseCase;
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
 * 가챠 API
 */
@Tag(name = "가챠", description = "가챠 뽑기, 티켓 교환, 천장 조회 API")
@Validated
@RestController
@RequestMapping("/api/gacha")
@RequiredArgsConstructor
public class GachaController {

    private final DrawGachaUseCase drawGachaUseCase;
    private final ExchangeGachaTicketUseCase exchangeGachaTicketUseCase;
    private final GetPityStatusUseCase getPityStatusUseCase;

    /**
     * 가챠 뽑기
     * POST /api/gacha/{campaignKey}/draw
     */
    @Operation(summary = "가챠 뽑기", description = "티켓을 소모해 뽑기를 진행하고 천장 카운터를 갱신합니다")
    @PostMapping("/{campaignKey}/draw")
    public ResponseEntity<GachaDrawResponse> draw(
            @Parameter(description = "캠페인 키") @PathVariable String campaignKey,
            @Valid @RequestBody DrawGachaRequest request) {
        GachaDrawResponse response = drawGachaUseCase.execute(campaignKey, request);
        return ResponseEntity.ok(response);
    }

    /**
     * 뽑기 티켓 교환
     * POST /api/gacha/{campaignKey}/exchange
     */
    @Operation(summary = "티켓 교환", description = "재화를 소모해 뽑기 티켓으로 교환합니다")
    @PostMapping("/{campaignKey}/exchange")
    public ResponseEntity<ExchangeTicketResponse> exchange(
            @Parameter(description = "캠페인 키") @PathVariable String campaignKey,
            @Valid @RequestBody ExchangeTicketRequest request) {
        ExchangeTicketResponse response = exchangeGachaTicketUseCase.execute(campaignKey, request);
        return ResponseEntity.ok(response);
    }

    /**
     * 천장 진행 상황 조회
     * GET /api/gacha/{campaignKey}/pity?accountId=
     */
    @Operation(summary = "천장 조회", description = "천장까지 남은 뽑기 횟수를 조회합니다")
    @GetMapping("/{campaignKey}/pity")
    public ResponseEntity<PityStatusResponse> getPityStatus(
            @Parameter(description = "캠페인 키") @PathVariable String campaignKey,
            @Parameter(description = "계정 ID") @RequestParam @NotBlank(message = "계정 ID는 필수입니다") String accountId) {
        PityStatusResponse response = getPityStatusUseCase.execute(campaignKey, accountId);
        return ResponseEntity.ok(response);
    }
}
