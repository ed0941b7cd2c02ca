package com.sparta.reward.domain.gacha.vo;

import com.sparta.reward.domain.gacha.entity.PityCounter;

/**
 * 배치 동안 유지되는 (저장된 카운터, 메모리 상태) 쌍
 */
public record PitySession(PityCounter counter, PityState state) {

    public static PitySession of(PityCounter counter) {
        return new PitySession(counter, counter.toState());
    }

    /**
     * 메모리 상태를 카운터 엔티티에 반영
     */
    public PityCounter flush() {
        counter.apply(state);
        return counter;
    }
}
