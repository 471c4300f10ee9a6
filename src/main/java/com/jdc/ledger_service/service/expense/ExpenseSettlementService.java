package com.jdc.ledger_service.service.expense;

import com.jdc.ledger_service.domain.dto.expense.SettlementResult;
import com.jdc.ledger_service.domain.entity.expense.Expense;
import com.jdc.ledger_service.domain.entity.expense.ExpenseShare;
import com.jdc.ledger_service.domain.entity.household.Household;
import com.jdc.ledger_service.domain.repository.expense.ExpenseRepository;
import com.jdc.ledger_service.domain.repository.expense.ExpenseShareRepository;
import com.jdc.ledger_service.domain.type.ExpenseStatus;
import com.jdc.ledger_service.domain.type.ShareStatus;
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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseSettlementService {

    private final ExpenseRepository expenseRepository;
    private final ExpenseShareRepository expenseShareRepository;
    private final HouseholdLockService householdLockService;
    private final UsageLedgerService usageLedgerService;
    private final Clock clock;

    /**
     * debtor 가 recipient 에게 갚을 몫을 모두 정산 처리한다.
     * 모든 몫이 정산된 지출은 fully_paid_at 이 한 번만 기록되고, 그때만 active_expenses 를 1 줄인다.
     */
    @Transactional
    public SettlementResult payMyDue(Long debtorId, Long recipientId) {
        if (debtorId.equals(recipientId)) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "자기 자신에게는 정산할 수 없습니다.");
        }

        List<Object[]> targets = expenseRepository.findSettlementTargets(
                debtorId, recipientId, ExpenseStatus.ACTIVE, ShareStatus.UNPAID);
        if (targets.isEmpty()) {
            return emptyResult(debtorId, recipientId);
        }

        Set<Long> expenseIds = new TreeSet<>();
        Set<Long> householdIds = new TreeSet<>();
        for (Object[] row : targets) {
            expenseIds.add((Long) row[0]);
            householdIds.add((Long) row[1]);
        }

        // 가구 -> 지출 -> 분담 순서로 잠근다.
        Set<Long> activeHouseholds = householdLockService.lockAllInOrder(householdIds).stream()
                .filter(Household::isActive)
                .map(Household::getId)
                .collect(Collectors.toSet());

        List<Expense> expenses = expenseRepository.findAllByIdInForUpdate(expenseIds).stream()
                .filter(e -> activeHouseholds.contains(e.getHouseholdId()))
                .filter(e -> e.getStatus() == ExpenseStatus.ACTIVE && !e.isFullyPaid())
                .filter(e -> recipientId.equals(e.getOwnerId()))
                .toList();
        if (expenses.isEmpty()) {
            return emptyResult(debtorId, recipientId);
        }

        List<Long> lockedExpenseIds = expenses.stream().map(Expense::getId).toList();
        List<ExpenseShare> shares = expenseShareRepository.findForUpdate(lockedExpenseIds, debtorId, ShareStatus.UNPAID);

        LocalDateTime now = LocalDateTime.now(clock);
        int paidCount = 0;
        long paidAmount = 0;
        for (ExpenseShare share : shares) {
            if (share.markPaid(now)) {
                paidCount++;
                paidAmount += share.getAmountCents();
            }
        }
        expenseShareRepository.flush();

        List<Long> fullyPaid = new ArrayList<>();
        for (Expense expense : expenses) {
            if (expenseShareRepository.countByExpenseIdAndStatus(expense.getId(), ShareStatus.UNPAID) > 0) continue;
            if (expense.markFullyPaid(now)) {
                usageLedgerService.applyDelta(expense.getHouseholdId(), Map.of(UsageMetric.ACTIVE_EXPENSES, -1));
                fullyPaid.add(expense.getId());
            }
        }

        log.info("정산 완료: debtorId={}, recipientId={}, shares={}, amount={}, fullyPaid={}",
                debtorId, recipientId, paidCount, paidAmount, fullyPaid);

        return SettlementResult.builder()
                .debtorId(debtorId)
                .recipientId(recipientId)
                .paidShareCount(paidCount)
                .paidAmountCents(paidAmount)
                .fullyPaidExpenseIds(fullyPaid)
                .build();
    }

    private SettlementResult emptyResult(Long debtorId, Long recipientId) {
        return SettlementResult.builder()
                .debtorId(debtorId)
                .recipientId(recipientId)
                .paidShareCount(0)
                .paidAmountCents(0)
                .fullyPaidExpenseIds(List.of())
                .build();
    }
}
