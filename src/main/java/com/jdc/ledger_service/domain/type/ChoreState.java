package com.jdc.ledger_service.domain.type;

public enum ChoreState {
    DRAFT,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
