package com.sparta.reward.application.gacha.usecase;

import com.sparta.reward.application.gacha.dto.DrawGachaRequest;
import com.sparta.reward.application.gacha.dto.GachaDrawResponse;
import com.sparta.reward.application.gacha.service.DrawGachaService;
import com.sparta.reward.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 가챠 뽑기 유스케이스
 *
 * 동시성 제어 전략:
 * - Redisson 분산 락 (Redis 기반)
 * - 락 키: "lock:reward:account:{accountId}" (계정별 보상 락)
 * - 같은 계정의 모든 보상 배치(뽑기, 교환, 분해)가 직렬화된다
 *
 * 천장 카운터와 인벤토리를 같은 락 안에서 읽고 쓰므로
 * 동시 요청이 같은 카운터 값을 보고 천장을 중복 발동할 수 없다.
 */
@Service
@RequiredArgsConstructor
public class DrawGachaUseCase {

    private final DrawGachaService drawGachaService;

    @DistributedLock(key = "'reward:account:' + #request.accountId()")
    public GachaDrawResponse execute(String campaignKey, DrawGachaRequest request) {
        return drawGachaService.draw(campaignKey, request.accountId(), request.drawCount());
    }
}
