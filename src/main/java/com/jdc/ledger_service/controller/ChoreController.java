package com.jdc.ledger_service.controller;

import com.jdc.ledger_service.domain.dto.chore.ChoreCompletionResult;
import com.jdc.ledger_service.service.chore.ChoreCompletionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/chores")
@RequiredArgsConstructor
@Tag(name = "집안일 API", description = "집안일 완료 처리 API입니다.")
public class ChoreController {

    private final ChoreCompletionService choreCompletionService;

    @PostMapping("/{choreId}/complete")
    @Operation(summary = "집안일 완료", description = "반복 집안일은 다음 회차로 넘어가고, 일회성 집안일은 완료 상태가 됩니다.")
    public ResponseEntity<ChoreCompletionResult> complete(
            @PathVariable Long choreId,
            @RequestHeader("X-Member-Id") Long memberId) {
        return ResponseEntity.ok(choreCompletionService.complete(choreId, memberId));
    }
}
