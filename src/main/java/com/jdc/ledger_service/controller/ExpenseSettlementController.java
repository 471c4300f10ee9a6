package com.jdc.ledger_service.controller;

import com.jdc.ledger_service.domain.dto.expense.SettlementResult;
import com.jdc.ledger_service.service.expense.ExpenseSettlementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Tag(name = "지출 정산 API", description = "분담금 정산 API입니다.")
public class ExpenseSettlementController {

    private final ExpenseSettlementService expenseSettlementService;

    @PostMapping("/pay-my-due")
    @Operation(summary = "내 분담금 정산", description = "recipientId 에게 갚을 미정산 분담금을 모두 정산 처리합니다.")
    public ResponseEntity<SettlementResult> payMyDue(
            @RequestHeader("X-Member-Id") Long memberId,
            @RequestParam Long recipientId) {
        return ResponseEntity.ok(expenseSettlementService.payMyDue(memberId, recipientId));
    }
}
