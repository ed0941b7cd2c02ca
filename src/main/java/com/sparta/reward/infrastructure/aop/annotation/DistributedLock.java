package com.sparta.reward.infrastructure.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산 락 어노테이션
 * 실제 락 키는 "lock:" + key(SpEL 평가 결과)
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 식별자 (SpEL 지원: 예: 'reward:account:'.concat(#accountId))
     */
    String key();

    TimeUnit timeUnit() default TimeUnit.SECONDS;

    /**
     * 락 획득 대기 시간. 음수면 설정값(reward.lock.wait-seconds) 사용
     */
    long waitTime() default -1L;

    /**
     * 락 자동 해제 시간. 음수면 설정값(reward.lock.lease-seconds) 사용
     */
    long leaseTime() default -1L;
}
