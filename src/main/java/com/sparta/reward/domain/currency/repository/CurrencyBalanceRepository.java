package com.sparta.reward.domain.currency.repository;

import com.sparta.reward.domain.currency.entity.CurrencyBalance;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * 재화 잔액 저장소
 */
public interface CurrencyBalanceRepository extends JpaRepository<CurrencyBalance, String> {

    Optional<CurrencyBalance> findByAccountIdAndCurrencyKey(String accountId, String currencyKey);
}
