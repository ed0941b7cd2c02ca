package com.sparta.reward.infrastructure.aop;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * AOP에서 트랜잭션 분리를 위한 클래스
 * 분산 락 해제가 트랜잭션 커밋 이후에 발생하도록 보장
 */
@Component
@Slf4j
public class AopForTransaction {

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Object proceed(final ProceedingJoinPoint joinPoint) throws Throwable {
        log.debug("새 트랜잭션 시작 (REQUIRES_NEW) - method={}, active={}",
                joinPoint.getSignature().toShortString(),
                TransactionSynchronizationManager.isActualTransactionActive());
        return joinPoint.proceed();
    }
}
