package com.jdc.ledger_service.service.chore;

import com.jdc.ledger_service.domain.dto.chore.ChoreCompletionResult;
import com.jdc.ledger_service.domain.dto.chore.CursorAdvance;
import com.jdc.ledger_service.domain.entity.chore.Chore;
import com.jdc.ledger_service.domain.repository.chore.ChoreRepository;
import com.jdc.ledger_service.domain.type.ChoreCompletionStatus;
import com.jdc.ledger_service.domain.type.ChoreState;
import com.jdc.ledger_service.domain.type.UsageMetric;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import com.jdc.ledger_service.service.household.HouseholdLockService;
import com.jdc.ledger_service.service.usage.UsageLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChoreCompletionService {

    private final ChoreRepository choreRepository;
    private final HouseholdLockService householdLockService;
    private final ChoreCursorAdvancer choreCursorAdvancer;
    private final UsageLedgerService usageLedgerService;
    private final Clock clock;

    @Transactional
    public ChoreCompletionResult complete(Long choreId, Long actorId) {
        Long householdId = choreRepository.findHouseholdIdById(choreId)
                .orElseThrow(() -> new CustomException(ErrorCode.CHORE_NOT_FOUND));

        householdLockService.lockActive(householdId);

        Chore chore = choreRepository.findByIdForUpdate(choreId)
                .orElseThrow(() -> new CustomException(ErrorCode.CHORE_NOT_FOUND));
        if (!householdId.equals(chore.getHouseholdId())) {
            throw new CustomException(ErrorCode.CONCURRENT_MODIFICATION);
        }
        if (!actorId.equals(chore.getAssigneeId())) {
            throw new CustomException(ErrorCode.CHORE_NOT_ASSIGNEE);
        }
        if (chore.getState() != ChoreState.ACTIVE) {
            throw new CustomException(ErrorCode.CHORE_NOT_ACTIVE);
        }

        LocalDate today = LocalDate.now(clock);
        LocalDateTime now = LocalDateTime.now(clock);

        if (chore.isRecurring()) {
            CursorAdvance advance = choreCursorAdvancer.advance(chore, today);
            if (!advance.advanced()) {
                return result(chore, ChoreCompletionStatus.ALREADY_COMPLETED_FOR_CYCLE, 0);
            }
            chore.moveCursor(advance.cursor(), now);
            log.info("반복 집안일 완료: choreId={}, cursor={}, steps={}", choreId, advance.cursor(), advance.steps());
            return result(chore, ChoreCompletionStatus.RECURRING_COMPLETED, advance.steps());
        }

        chore.complete(now);
        usageLedgerService.applyDelta(householdId, Map.of(UsageMetric.ACTIVE_CHORES, -1));
        log.info("집안일 완료: choreId={}", choreId);
        return result(chore, ChoreCompletionStatus.NON_RECURRING_COMPLETED, 0);
    }

    private ChoreCompletionResult result(Chore chore, ChoreCompletionStatus status, int steps) {
        return ChoreCompletionResult.builder()
                .choreId(chore.getId())
                .status(status)
                .recurrenceCursor(chore.getRecurrenceCursor())
                .steps(steps)
                .completedAt(chore.getCompletedAt())
                .build();
    }
}
