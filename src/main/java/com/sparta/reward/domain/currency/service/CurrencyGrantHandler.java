package com.sparta.reward.domain.currency.service;

import com.sparta.reward.domain.currency.entity.CurrencyBalance;
import com.sparta.reward.domain.currency.repository.CurrencyBalanceRepository;
import com.sparta.reward.domain.reward.RewardType;
import com.sparta.reward.domain.reward.service.RewardGrantHandler;
import com.sparta.reward.domain.reward.vo.RewardHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 재화 보상 지급 처리기
 * 잔액이 음수가 되는 차감은 시뮬레이션 단계에서 거부된다
 */
@Component
@RequiredArgsConstructor
public class CurrencyGrantHandler implements RewardGrantHandler {

    private final CurrencyBalanceRepository currencyBalanceRepository;

    @Override
    public RewardType supportedType() {
        return RewardType.CURRENCY;
    }

    @Override
    public boolean simulate(String accountId, RewardHandler reward) {
        if (reward.amount() == 0) {
            return false;
        }
        return currencyBalanceRepository.findByAccountIdAndCurrencyKey(accountId, reward.typeKey())
                .map(balance -> balance.canApply(reward.amount()))
                .orElse(reward.amount() > 0);
    }

    @Override
    public void apply(String accountId, RewardHandler reward) {
        CurrencyBalance balance = currencyBalanceRepository.findByAccountIdAndCurrencyKey(accountId, reward.typeKey())
                .orElseGet(() -> CurrencyBalance.zero(accountId, reward.typeKey()));
        balance.apply(reward.amount());
        currencyBalanceRepository.save(balance);
    }
}
