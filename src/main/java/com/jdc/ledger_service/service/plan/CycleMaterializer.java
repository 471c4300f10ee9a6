package com.jdc.ledger_service.service.plan;

import com.jdc.ledger_service.domain.dto.plan.MaterializationResult;
import com.jdc.ledger_service.domain.entity.expense.Expense;
import com.jdc.ledger_service.domain.entity.expense.ExpenseShare;
import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.repository.expense.ExpenseCycleDao;
import com.jdc.ledger_service.domain.repository.expense.ExpenseRepository;
import com.jdc.ledger_service.domain.repository.expense.ExpenseShareRepository;
import com.jdc.ledger_service.domain.repository.plan.RecurringPlanRepository;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 반복 지출의 한 회차를 지출로 만든다. (plan, dueDate) 기준 멱등.
 * 한도 검사는 하지 않는다. 활성화 시점 검사는 RecurringPlanService, 스케줄러는 검사 없이 생성.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CycleMaterializer {

    private final RecurringPlanRepository recurringPlanRepository;
    private final ExpenseCycleDao expenseCycleDao;
    private final ExpenseRepository expenseRepository;
    private final ExpenseShareRepository expenseShareRepository;
    private final HouseholdLockService householdLockService;
    private final UsageLedgerService usageLedgerService;
    private final Clock clock;

    @Transactional
    public MaterializationResult materialize(Long planId, LocalDate dueDate) {
        Long householdId = recurringPlanRepository.findHouseholdIdById(planId)
                .orElseThrow(() -> new CustomException(ErrorCode.PLAN_NOT_FOUND));

        householdLockService.lockActive(householdId);

        RecurringPlan plan = recurringPlanRepository.findByIdForUpdate(planId)
                .orElseThrow(() -> new CustomException(ErrorCode.PLAN_NOT_FOUND));
        if (!householdId.equals(plan.getHouseholdId())) {
            throw new CustomException(ErrorCode.CONCURRENT_MODIFICATION);
        }
        if (!plan.isActive()) {
            throw new CustomException(ErrorCode.PLAN_NOT_ACTIVE);
        }
        if (dueDate.isBefore(plan.getStartDate())) {
            throw new CustomException(ErrorCode.INVALID_CYCLE_DATE,
                    String.format("회차 날짜(%s)가 시작일(%s)보다 빠릅니다.", dueDate, plan.getStartDate()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Long> inserted = expenseCycleDao.insertIfAbsent(
                new ExpenseCycleDao.CycleRow(householdId, planId, plan.getOwnerId(), dueDate,
                        plan.getAmountCents(), plan.getDescription()),
                now);

        if (inserted.isEmpty()) {
            Expense existing = expenseRepository.findByPlanIdAndDueDateForShare(planId, dueDate)
                    .orElseThrow(() -> new CustomException(ErrorCode.STATE_CHANGED_RETRY));
            return MaterializationResult.of(existing, false);
        }

        Long expenseId = inserted.get();
        usageLedgerService.applyDelta(householdId, Map.of(UsageMetric.ACTIVE_EXPENSES, 1));

        List<ExpenseShare> shares = plan.getShares().stream()
                .map(s -> s.getParticipantId().equals(plan.getOwnerId())
                        ? ExpenseShare.settled(expenseId, s.getParticipantId(), s.getShareAmountCents(), now)
                        : ExpenseShare.unpaid(expenseId, s.getParticipantId(), s.getShareAmountCents()))
                .toList();
        expenseShareRepository.saveAll(shares);

        log.info("회차 지출 생성: planId={}, dueDate={}, expenseId={}", planId, dueDate, expenseId);

        Expense expense = expenseRepository.findById(expenseId)
                .orElseThrow(() -> new CustomException(ErrorCode.STATE_CHANGED_RETRY));
        return MaterializationResult.of(expense, true);
    }
}
