package com.jdc.ledger_service.controller;

import com.jdc.ledger_service.domain.dto.usage.UsageSnapshotDto;
import com.jdc.ledger_service.service.usage.UsageLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/households")
@RequiredArgsConstructor
@Tag(name = "가구 사용량 API", description = "요금제 한도 대비 사용량 조회 API입니다.")
public class UsageController {

    private final UsageLedgerService usageLedgerService;

    @GetMapping("/{householdId}/usage")
    @Operation(summary = "가구 사용량 조회", description = "지표별 사용량, 한도, 남은 수량과 현재 등급을 반환합니다. 한도가 null 이면 무제한입니다.")
    public ResponseEntity<UsageSnapshotDto> getUsage(@PathVariable Long householdId) {
        return ResponseEntity.ok(usageLedgerService.getUsage(householdId));
    }
}
