package com.jdc.ledger_service.controller;

import com.jdc.ledger_service.domain.dto.scheduler.DueCycleRunSummary;
import com.jdc.ledger_service.service.plan.DueCycleBatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/admin/due-cycles")
@RequiredArgsConstructor
@Tag(name = "관리자 스케줄러 API", description = "반복 지출 회차 생성 수동 실행")
public class AdminDueCycleController {

    private final DueCycleBatchService dueCycleBatchService;
    private final Clock clock;

    @PostMapping("/run")
    @Operation(summary = "회차 생성 수동 실행", description = "스케줄러와 같은 작업을 즉시 실행하고 요약을 반환합니다.")
    public ResponseEntity<DueCycleRunSummary> run() {
        return ResponseEntity.ok(dueCycleBatchService.runDueCycles(LocalDate.now(clock)));
    }
}
