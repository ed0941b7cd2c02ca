package com.sparta.reward.infrastructure.aop;

import com.sparta.reward.common.exception.DistributedLockException;
import com.sparta.reward.common.util.CustomSpringELParser;
import com.sparta.reward.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 분산 락 AOP
 *
 * 락 획득 → 새 트랜잭션 시작 → 커밋 → 락 해제 순서를 보장한다.
 * 같은 계정에 대한 보상 요청은 이 락으로 직렬화된다.
 */
@Slf4j
@Aspect
@Order(0)
@Component
@RequiredArgsConstructor
public class DistributedLockAspect {

    private static final String LOCK_PREFIX = "lock:";

    private final RedissonClient redissonClient;
    private final AopForTransaction aopForTransaction;

    @Value("${reward.lock.wait-seconds:10}")
    private long defaultWaitSeconds;

    @Value("${reward.lock.lease-seconds:5}")
    private long defaultLeaseSeconds;

    @Around("@annotation(distributedLock)")
    public Object lock(ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String key = LOCK_PREFIX + CustomSpringELParser.getDynamicValue(
                signature.getParameterNames(),
                joinPoint.getArgs(),
                distributedLock.key()
        );

        long waitTime = distributedLock.waitTime() >= 0 ? distributedLock.waitTime() : defaultWaitSeconds;
        long leaseTime = distributedLock.leaseTime() >= 0 ? distributedLock.leaseTime() : defaultLeaseSeconds;

        RLock rLock = redissonClient.getLock(key);
        try {
            boolean available = rLock.tryLock(waitTime, leaseTime, distributedLock.timeUnit());
            if (!available) {
                log.warn("분산 락 획득 실패 - key={}", key);
                throw new DistributedLockException(key);
            }
            log.debug("분산 락 획득 - key={}", key);
            return aopForTransaction.proceed(joinPoint);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DistributedLockException(key, e);
        } finally {
            if (rLock.isHeldByCurrentThread()) {
                rLock.unlock();
                log.debug("분산 락 해제 - key={}", key);
            }
        }
    }
}
