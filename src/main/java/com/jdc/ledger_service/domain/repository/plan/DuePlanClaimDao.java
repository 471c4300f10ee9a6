package com.jdc.ledger_service.domain.repository.plan;

import java.time.LocalDate;

/**
 * 스케줄러가 처리할 가구/플랜 행을 선점한다.
 * 다른 트랜잭션이 잡고 있는 행은 기다리지 않고 건너뛰는 것이 원칙이다.
 * 락 순서는 다른 경로와 같다: 가구 -> 플랜.
 */
public interface DuePlanClaimDao {

    /**
     * @return 활성 가구 행을 기다리지 않고 잠갔으면 true. 다른 트랜잭션이 잡고 있거나 비활성이면 false
     */
    boolean tryLockHousehold(Long householdId);

    /**
     * @return 활성 상태이고 today 기준 도래한 플랜을 잠갔으면 true
     */
    boolean tryClaim(Long planId, LocalDate today);
}
