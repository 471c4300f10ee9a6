package com.jdc.ledger_service.domain.dto.plan;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PlanActivationResponseDto {
    private RecurringPlanResponseDto plan;
    private MaterializationResult firstCycle;
}
