package com.jdc.ledger_service.domain.dto.scheduler;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@Builder
public class DueCycleRunSummary {
    private LocalDate runDate;
    private int plansProcessed;
    private int cyclesCreated;
    private int cyclesReplayed;
    private int plansSkipped;
    private int plansFailed;
    private boolean budgetExhausted;
}
