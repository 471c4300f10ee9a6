package com.jdc.ledger_service.domain.type;

// 사이클로 생성되는 지출은 항상 ACTIVE 로 시작한다. (초안/전환 상태는 CRUD 계층 소관)
public enum ExpenseStatus {
    ACTIVE,
    CANCELLED
}
