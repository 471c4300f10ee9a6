package com.jdc.ledger_service.controller;

import com.jdc.ledger_service.domain.dto.plan.PlanActivationResponseDto;
import com.jdc.ledger_service.domain.dto.plan.PlanTerminationResult;
import com.jdc.ledger_service.domain.dto.plan.RecurringPlanCreateRequestDto;
import com.jdc.ledger_service.service.plan.RecurringPlanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "반복 지출 API", description = "반복 지출 활성화 및 종료 API입니다.")
public class RecurringPlanController {

    private final RecurringPlanService recurringPlanService;

    @PostMapping("/households/{householdId}/recurring-plans")
    @Operation(summary = "반복 지출 활성화", description = "한도 확인 후 반복 지출을 만들고 시작일 회차 지출을 바로 생성합니다.")
    public ResponseEntity<PlanActivationResponseDto> activate(
            @PathVariable Long householdId,
            @RequestHeader("X-Member-Id") Long memberId,
            @Valid @RequestBody RecurringPlanCreateRequestDto request) {
        PlanActivationResponseDto response = recurringPlanService.activate(householdId, memberId, request);
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @PostMapping("/recurring-plans/{planId}/terminate")
    @Operation(summary = "반복 지출 종료", description = "소유자만 종료할 수 있습니다. 이미 종료된 경우 changed=false 를 반환합니다.")
    public ResponseEntity<PlanTerminationResult> terminate(
            @PathVariable Long planId,
            @RequestHeader("X-Member-Id") Long memberId) {
        return ResponseEntity.ok(recurringPlanService.terminate(planId, memberId));
    }
}
