package com.jdc.ledger_service.domain.type;

public enum PlanStatus {
    ACTIVE,
    TERMINATED
}
