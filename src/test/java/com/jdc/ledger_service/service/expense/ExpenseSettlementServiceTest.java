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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpenseSettlementServiceTest {

    private static final Long HOUSEHOLD_ID = 1L;
    private static final Long EXPENSE_ID = 500L;
    private static final Long OWNER_A = 10L;
    private static final Long DEBTOR_B = 20L;
    private static final Long DEBTOR_C = 30L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-31T15:00:00Z"), ZoneId.of("Asia/Seoul"));

    @Mock
    private ExpenseRepository expenseRepository;
    @Mock
    private ExpenseShareRepository expenseShareRepository;
    @Mock
    private HouseholdLockService householdLockService;
    @Mock
    private UsageLedgerService usageLedgerService;

    private ExpenseSettlementService expenseSettlementService;
    private Expense expense;

    @BeforeEach
    void setUp() {
        expenseSettlementService = new ExpenseSettlementService(expenseRepository, expenseShareRepository,
                householdLockService, usageLedgerService, CLOCK);

        expense = Expense.builder()
                .id(EXPENSE_ID)
                .householdId(HOUSEHOLD_ID)
                .ownerId(OWNER_A)
                .dueDate(LocalDate.of(2024, 1, 15))
                .amountCents(3000)
                .build();
    }

    private void givenTarget(Long debtorId, ExpenseShare unpaidShare) {
        List<Object[]> rows = List.<Object[]>of(new Object[]{EXPENSE_ID, HOUSEHOLD_ID});
        when(expenseRepository.findSettlementTargets(debtorId, OWNER_A, ExpenseStatus.ACTIVE, ShareStatus.UNPAID))
                .thenReturn(rows);
        when(householdLockService.lockAllInOrder(Set.of(HOUSEHOLD_ID)))
                .thenReturn(List.of(Household.builder().id(HOUSEHOLD_ID).name("우리집").build()));
        when(expenseRepository.findAllByIdInForUpdate(Set.of(EXPENSE_ID))).thenReturn(List.of(expense));
        when(expenseShareRepository.findForUpdate(List.of(EXPENSE_ID), debtorId, ShareStatus.UNPAID))
                .thenReturn(List.of(unpaidShare));
    }

    @Test
    @DisplayName("성공: B 만 정산하면 C 가 남아 완납되지 않고, C 까지 정산하면 완납 처리되며 active_expenses -1")
    void payMyDue_fullyPaidAfterLastDebtor() {
        // given
        ExpenseShare shareB = ExpenseShare.unpaid(EXPENSE_ID, DEBTOR_B, 1000);
        ExpenseShare shareC = ExpenseShare.unpaid(EXPENSE_ID, DEBTOR_C, 1000);

        // when: B 정산
        givenTarget(DEBTOR_B, shareB);
        when(expenseShareRepository.countByExpenseIdAndStatus(EXPENSE_ID, ShareStatus.UNPAID)).thenReturn(1L);
        SettlementResult first = expenseSettlementService.payMyDue(DEBTOR_B, OWNER_A);

        // then
        assertThat(first.getPaidShareCount()).isEqualTo(1);
        assertThat(first.getPaidAmountCents()).isEqualTo(1000L);
        assertThat(first.getFullyPaidExpenseIds()).isEmpty();
        assertThat(shareB.isPaid()).isTrue();
        assertThat(expense.isFullyPaid()).isFalse();
        verify(usageLedgerService, never()).applyDelta(anyLong(), anyMap());

        // when: C 정산
        givenTarget(DEBTOR_C, shareC);
        when(expenseShareRepository.countByExpenseIdAndStatus(EXPENSE_ID, ShareStatus.UNPAID)).thenReturn(0L);
        SettlementResult second = expenseSettlementService.payMyDue(DEBTOR_C, OWNER_A);

        // then
        assertThat(second.getFullyPaidExpenseIds()).containsExactly(EXPENSE_ID);
        assertThat(expense.getFullyPaidAt()).isEqualTo(LocalDateTime.now(CLOCK));
        verify(usageLedgerService, times(1)).applyDelta(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, -1));
    }

    @Test
    @DisplayName("성공: 갚을 몫이 없으면 아무것도 잠그지 않고 빈 결과")
    void payMyDue_nothingToPay() {
        when(expenseRepository.findSettlementTargets(DEBTOR_B, OWNER_A, ExpenseStatus.ACTIVE, ShareStatus.UNPAID))
                .thenReturn(List.of());

        SettlementResult result = expenseSettlementService.payMyDue(DEBTOR_B, OWNER_A);

        assertThat(result.getPaidShareCount()).isZero();
        assertThat(result.getFullyPaidExpenseIds()).isEmpty();
        verifyNoInteractions(householdLockService, usageLedgerService);
    }

    @Test
    @DisplayName("성공: 잠그는 사이 이미 완납된 지출은 건너뛴다.")
    void payMyDue_alreadyFullyPaid() {
        expense.markFullyPaid(LocalDateTime.of(2024, 1, 20, 0, 0));
        List<Object[]> rows = List.<Object[]>of(new Object[]{EXPENSE_ID, HOUSEHOLD_ID});
        when(expenseRepository.findSettlementTargets(DEBTOR_B, OWNER_A, ExpenseStatus.ACTIVE, ShareStatus.UNPAID))
                .thenReturn(rows);
        when(householdLockService.lockAllInOrder(Set.of(HOUSEHOLD_ID)))
                .thenReturn(List.of(Household.builder().id(HOUSEHOLD_ID).name("우리집").build()));
        when(expenseRepository.findAllByIdInForUpdate(Set.of(EXPENSE_ID))).thenReturn(List.of(expense));

        SettlementResult result = expenseSettlementService.payMyDue(DEBTOR_B, OWNER_A);

        assertThat(result.getPaidShareCount()).isZero();
        verify(expenseShareRepository, never()).findForUpdate(any(), eq(DEBTOR_B), any());
        verifyNoInteractions(usageLedgerService);
    }

    @Test
    @DisplayName("성공: 비활성 가구의 지출은 정산하지 않는다.")
    void payMyDue_inactiveHousehold() {
        Household inactive = Household.builder().id(HOUSEHOLD_ID).name("우리집").active(false).build();
        List<Object[]> rows = List.<Object[]>of(new Object[]{EXPENSE_ID, HOUSEHOLD_ID});
        when(expenseRepository.findSettlementTargets(DEBTOR_B, OWNER_A, ExpenseStatus.ACTIVE, ShareStatus.UNPAID))
                .thenReturn(rows);
        when(householdLockService.lockAllInOrder(Set.of(HOUSEHOLD_ID))).thenReturn(List.of(inactive));
        when(expenseRepository.findAllByIdInForUpdate(Set.of(EXPENSE_ID))).thenReturn(List.of(expense));

        SettlementResult result = expenseSettlementService.payMyDue(DEBTOR_B, OWNER_A);

        assertThat(result.getPaidShareCount()).isZero();
        verifyNoInteractions(usageLedgerService);
    }

    @Test
    @DisplayName("실패: 자기 자신에게 정산하면 INVALID_INPUT_VALUE")
    void payMyDue_self() {
        assertThatThrownBy(() -> expenseSettlementService.payMyDue(OWNER_A, OWNER_A))
                .isInstanceOf(CustomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT_VALUE);
        verifyNoInteractions(expenseRepository);
    }
}
