package com.sparta.reward.application.gacha.usecase;

import com.sparta.reward.application.gacha.dto.ExchangeTicketRequest;
import com.sparta.reward.application.gacha.dto.ExchangeTicketResponse;
import com.sparta.reward.application.gacha.service.ExchangeTicketService;
import com.sparta.reward.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 뽑기 티켓 교환 유스케이스
 * 락 키: "lock:reward:account:{accountId}" (뽑기와 같은 락)
 */
@Service
@RequiredArgsConstructor
public class ExchangeGachaTicketUseCase {

    private final ExchangeTicketService exchangeTicketService;

    @DistributedLock(key = "'reward:account:' + #request.accountId()")
    public ExchangeTicketResponse execute(String campaignKey, ExchangeTicketRequest request) {
        return exchangeTicketService.exchange(campaignKey, request.accountId(), request.amount());
    }
}
