package com.jdc.ledger_service.service.plan;

import com.jdc.ledger_service.domain.entity.common.Recurrence;
import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.repository.plan.RecurringPlanRepository;
import com.jdc.ledger_service.domain.type.PlanStatus;
import com.jdc.ledger_service.domain.type.RecurrenceUnit;
import com.jdc.ledger_service.service.household.HouseholdLockService;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlanTerminationCascadeTest {

    private static final Long HOUSEHOLD_ID = 1L;
    private static final Long LEAVING_ID = 20L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-31T15:00:00Z"), ZoneId.of("Asia/Seoul"));

    @Mock
    private RecurringPlanRepository recurringPlanRepository;
    @Mock
    private HouseholdLockService householdLockService;

    private PlanTerminationCascade cascade;

    @BeforeEach
    void setUp() {
        cascade = new PlanTerminationCascade(recurringPlanRepository, householdLockService, CLOCK);
    }

    private RecurringPlan plan(Long id, Long ownerId, Long... debtors) {
        RecurringPlan plan = RecurringPlan.builder()
                .id(id)
                .householdId(HOUSEHOLD_ID)
                .ownerId(ownerId)
                .recurrence(Recurrence.of(1, RecurrenceUnit.MONTH))
                .startDate(LocalDate.of(2024, 1, 1))
                .nextDueDate(LocalDate.of(2024, 2, 1))
                .amountCents(1000L * (debtors.length + 1))
                .build();
        for (Long debtor : debtors) {
            plan.addShare(debtor, 1000);
        }
        return plan;
    }

    @Test
    @DisplayName("성공: 떠나는 구성원이 소유하거나 분담하는 활성 플랜을 모두 종료한다.")
    void onParticipantRemoved_terminatesInvolvedPlans() {
        // given
        RecurringPlan owned = plan(5L, LEAVING_ID, 30L);
        RecurringPlan sharing = plan(7L, 30L, LEAVING_ID);
        when(recurringPlanRepository.findPlanIdsInvolving(HOUSEHOLD_ID, LEAVING_ID, PlanStatus.ACTIVE))
                .thenReturn(List.of(5L, 7L));
        when(recurringPlanRepository.findAllByIdInForUpdate(List.of(5L, 7L))).thenReturn(List.of(owned, sharing));

        // when
        List<Long> terminated = cascade.onParticipantRemoved(HOUSEHOLD_ID, LEAVING_ID);

        // then
        assertThat(terminated).containsExactly(5L, 7L);
        assertThat(owned.getStatus()).isEqualTo(PlanStatus.TERMINATED);
        assertThat(sharing.getTerminatedAt()).isEqualTo(LocalDateTime.now(CLOCK));
        verify(householdLockService).lock(HOUSEHOLD_ID);
    }

    @Test
    @DisplayName("성공: 락을 잡는 사이 이미 종료된 플랜은 결과에서 빠진다.")
    void onParticipantRemoved_skipsAlreadyTerminated() {
        RecurringPlan alreadyTerminated = plan(5L, LEAVING_ID, 30L);
        alreadyTerminated.terminate(LocalDateTime.of(2024, 1, 20, 0, 0));
        when(recurringPlanRepository.findPlanIdsInvolving(HOUSEHOLD_ID, LEAVING_ID, PlanStatus.ACTIVE))
                .thenReturn(List.of(5L));
        when(recurringPlanRepository.findAllByIdInForUpdate(List.of(5L))).thenReturn(List.of(alreadyTerminated));

        List<Long> terminated = cascade.onParticipantRemoved(HOUSEHOLD_ID, LEAVING_ID);

        assertThat(terminated).isEmpty();
        assertThat(alreadyTerminated.getTerminatedAt()).isEqualTo(LocalDateTime.of(2024, 1, 20, 0, 0));
    }

    @Test
    @DisplayName("성공: 관련 플랜이 없으면 플랜 행을 잠그지 않는다.")
    void onParticipantRemoved_noPlans() {
        when(recurringPlanRepository.findPlanIdsInvolving(HOUSEHOLD_ID, LEAVING_ID, PlanStatus.ACTIVE))
                .thenReturn(List.of());

        assertThat(cascade.onParticipantRemoved(HOUSEHOLD_ID, LEAVING_ID)).isEmpty();
        verify(recurringPlanRepository, never()).findAllByIdInForUpdate(any());
    }
}
