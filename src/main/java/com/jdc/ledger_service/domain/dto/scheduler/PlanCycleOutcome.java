package com.jdc.ledger_service.domain.dto.scheduler;

import java.time.LocalDate;

/**
 * 플랜 하나를 처리한 결과. claimed=false 면 다른 워커가 잡고 있었거나 대상이 아니게 된 것.
 */
public record PlanCycleOutcome(Long planId, boolean claimed, int created, int replayed, LocalDate nextDueDate) {

    public static PlanCycleOutcome skipped(Long planId) {
        return new PlanCycleOutcome(planId, false, 0, 0, null);
    }

    public int cycles() {
        return created + replayed;
    }
}
