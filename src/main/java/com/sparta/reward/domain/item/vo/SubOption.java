package com.sparta.reward.domain.item.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * 장비 서브 옵션 Value Object
 */
@Embeddable
public record SubOption(
        @Column(name = "option_key", nullable = false)
        String optionKey,

        @Column(name = "option_value", nullable = false)
        int optionValue
) {

    public SubOption {
        if (optionKey == null || optionKey.isBlank()) {
            throw new IllegalArgumentException("옵션 키는 비어 있을 수 없습니다");
        }
    }
}
