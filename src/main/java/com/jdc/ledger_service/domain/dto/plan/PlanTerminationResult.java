package com.jdc.ledger_service.domain.dto.plan;

import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.type.PlanStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
public class PlanTerminationResult {
    private Long planId;
    private PlanStatus status;
    private LocalDateTime terminatedAt;
    private boolean changed;

    public static PlanTerminationResult of(RecurringPlan plan, boolean changed) {
        return PlanTerminationResult.builder()
                .planId(plan.getId())
                .status(plan.getStatus())
                .terminatedAt(plan.getTerminatedAt())
                .changed(changed)
                .build();
    }
}
