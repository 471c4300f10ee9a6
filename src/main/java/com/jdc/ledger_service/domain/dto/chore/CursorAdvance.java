package com.jdc.ledger_service.domain.dto.chore;

import java.time.LocalDate;

/**
 * steps 가 0 이면 이번 회차는 이미 처리된 상태.
 */
public record CursorAdvance(LocalDate cursor, int steps) {

    public boolean advanced() {
        return steps > 0;
    }
}
