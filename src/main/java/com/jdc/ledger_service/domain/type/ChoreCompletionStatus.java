package com.jdc.ledger_service.domain.type;

public enum ChoreCompletionStatus {
    NON_RECURRING_COMPLETED,
    RECURRING_COMPLETED,
    ALREADY_COMPLETED_FOR_CYCLE
}
