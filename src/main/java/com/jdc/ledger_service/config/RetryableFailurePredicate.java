package com.jdc.ledger_service.config;

import com.jdc.ledger_service.exception.CustomException;
import org.springframework.dao.PessimisticLockingFailureException;

import java.util.function.Predicate;

/**
 * resilience4j dueCycle 재시도 대상. 락 획득 실패와 retryable 로 표시된 충돌만 다시 시도한다.
 */
public class RetryableFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable ex) {
        if (ex instanceof PessimisticLockingFailureException) {
            return true;
        }
        return ex instanceof CustomException ce && ce.getErrorCode().isRetryable();
    }
}
