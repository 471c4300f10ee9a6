package com.jdc.ledger_service.domain.dto.plan;

import com.jdc.ledger_service.domain.entity.expense.Expense;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * created=false 면 같은 회차가 이미 있어 기존 지출을 돌려준 것.
 */
@Getter
@Builder
public class MaterializationResult {
    private Long expenseId;
    private Long planId;
    private LocalDate dueDate;
    private long amountCents;
    private boolean created;

    public static MaterializationResult of(Expense expense, boolean created) {
        return MaterializationResult.builder()
                .expenseId(expense.getId())
                .planId(expense.getPlanId())
                .dueDate(expense.getDueDate())
                .amountCents(expense.getAmountCents())
                .created(created)
                .build();
    }
}
