package com.jdc.ledger_service.domain.dto.expense;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class SettlementResult {
    private Long debtorId;
    private Long recipientId;
    private int paidShareCount;
    private long paidAmountCents;
    // 이번 정산으로 완납된 지출
    private List<Long> fullyPaidExpenseIds;
}
