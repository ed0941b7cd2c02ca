package com.sparta.reward.domain.currency.entity;

import com.sparta.reward.domain.currency.exception.InsufficientCurrencyException;
import com.sparta.reward.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 계정별 재화 잔액
 */
@Entity
@Table(name = "currency_balances", uniqueConstraints = {
        @UniqueConstraint(name = "uk_currency_balances_account_currency", columnNames = {"account_id", "currency_key"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CurrencyBalance extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String currencyBalanceId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "currency_key", nullable = false)
    private String currencyKey;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Version
    private Long version;

    public static CurrencyBalance zero(String accountId, String currencyKey) {
        return CurrencyBalance.builder()
                .accountId(accountId)
                .currencyKey(currencyKey)
                .amount(0L)
                .build();
    }

    /**
     * 변경 후 잔액이 음수가 되지 않는지 확인
     */
    public boolean canApply(long delta) {
        return amount + delta >= 0;
    }

    /**
     * 잔액 증감
     * @throws InsufficientCurrencyException 잔액이 부족한 경우
     */
    public void apply(long delta) {
        if (!canApply(delta)) {
            throw new InsufficientCurrencyException(currencyKey, -delta, amount);
        }
        this.amount += delta;
    }
}
