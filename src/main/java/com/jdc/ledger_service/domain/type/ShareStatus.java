package com.jdc.ledger_service.domain.type;

public enum ShareStatus {
    UNPAID,
    PAID
}
