package com.jdc.ledger_service.domain.dto.chore;

import com.jdc.ledger_service.domain.type.ChoreCompletionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Getter
@Builder
public class ChoreCompletionResult {
    private Long choreId;
    private ChoreCompletionStatus status;
    private LocalDate recurrenceCursor;
    private int steps;
    private LocalDateTime completedAt;
}
