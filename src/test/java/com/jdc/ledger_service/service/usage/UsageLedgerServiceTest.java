package com.jdc.ledger_service.service.usage;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.dto.usage.MetricUsageDto;
import com.jdc.ledger_service.domain.dto.usage.UsageSnapshotDto;
import com.jdc.ledger_service.domain.entity.usage.UsageLedger;
import com.jdc.ledger_service.domain.repository.household.HouseholdRepository;
import com.jdc.ledger_service.domain.repository.usage.UsageLedgerRepository;
import com.jdc.ledger_service.domain.type.UsageMetric;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import com.jdc.ledger_service.service.household.HouseholdLockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UsageLedgerServiceTest {

    private static final Long HOUSEHOLD_ID = 7L;

    @Mock
    private UsageLedgerRepository usageLedgerRepository;
    @Mock
    private HouseholdRepository householdRepository;
    @Mock
    private HouseholdLockService householdLockService;
    @Mock
    private PlanLimitRegistry planLimitRegistry;

    private UsageLedgerService usageLedgerService;

    @BeforeEach
    void setUp() {
        usageLedgerService = new UsageLedgerService(usageLedgerRepository, householdRepository,
                householdLockService, planLimitRegistry, new LedgerProperties());
    }

    @Test
    @DisplayName("성공: 사용량 행이 없으면 처음 참조할 때 만들고 증감을 반영한다.")
    void applyDelta_createsLedgerLazily() {
        when(usageLedgerRepository.findByIdForUpdate(HOUSEHOLD_ID)).thenReturn(Optional.empty());
        when(usageLedgerRepository.save(any(UsageLedger.class))).thenAnswer(inv -> inv.getArgument(0));

        UsageLedger ledger = usageLedgerService.applyDelta(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, 1));

        assertThat(ledger.getHouseholdId()).isEqualTo(HOUSEHOLD_ID);
        assertThat(ledger.getActiveExpenses()).isEqualTo(1);
        verify(householdLockService).lockActive(HOUSEHOLD_ID);
    }

    @Test
    @DisplayName("성공: 결과가 음수가 되는 감소는 0 으로 보정")
    void applyDelta_clamps() {
        UsageLedger existing = UsageLedger.builder().householdId(HOUSEHOLD_ID).activeChores(1).build();
        when(usageLedgerRepository.findByIdForUpdate(HOUSEHOLD_ID)).thenReturn(Optional.of(existing));

        UsageLedger ledger = usageLedgerService.applyDelta(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_CHORES, -3));

        assertThat(ledger.getActiveChores()).isZero();
        verify(usageLedgerRepository, never()).save(any());
    }

    @Test
    @DisplayName("실패: 비활성 가구의 사용량은 변경할 수 없다.")
    void applyDelta_inactiveHousehold() {
        when(householdLockService.lockActive(HOUSEHOLD_ID)).thenThrow(new CustomException(ErrorCode.TENANT_INACTIVE));

        assertThatThrownBy(() -> usageLedgerService.applyDelta(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_CHORES, 1)))
                .isInstanceOf(CustomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TENANT_INACTIVE);

        verifyNoInteractions(usageLedgerRepository);
    }

    @Test
    @DisplayName("성공: 사용량 조회는 지표별 사용량/한도/남은 수량을 돌려준다.")
    void getUsage_freeTier() {
        when(householdRepository.existsById(HOUSEHOLD_ID)).thenReturn(true);
        when(usageLedgerRepository.findById(HOUSEHOLD_ID)).thenReturn(Optional.of(
                UsageLedger.builder().householdId(HOUSEHOLD_ID).activeExpenses(3).build()));
        when(planLimitRegistry.effectiveTier(HOUSEHOLD_ID)).thenReturn("free");
        when(planLimitRegistry.limitsFor("free")).thenReturn(Map.of(UsageMetric.ACTIVE_EXPENSES, 10));

        UsageSnapshotDto snapshot = usageLedgerService.getUsage(HOUSEHOLD_ID);

        assertThat(snapshot.getTier()).isEqualTo("free");
        assertThat(snapshot.isUnrestricted()).isFalse();
        assertThat(snapshot.getMetrics()).hasSize(UsageMetric.values().length);

        MetricUsageDto expenses = snapshot.getMetrics().stream()
                .filter(m -> m.getMetric() == UsageMetric.ACTIVE_EXPENSES).findFirst().orElseThrow();
        assertThat(expenses.getUsed()).isEqualTo(3);
        assertThat(expenses.getLimit()).isEqualTo(10);
        assertThat(expenses.getRemaining()).isEqualTo(7);

        MetricUsageDto photos = snapshot.getMetrics().stream()
                .filter(m -> m.getMetric() == UsageMetric.ITEM_PHOTOS).findFirst().orElseThrow();
        assertThat(photos.getLimit()).isNull();
        assertThat(photos.getRemaining()).isNull();
    }

    @Test
    @DisplayName("성공: premium 등급은 모든 한도가 null(무제한)")
    void getUsage_premium() {
        when(householdRepository.existsById(HOUSEHOLD_ID)).thenReturn(true);
        when(usageLedgerRepository.findById(HOUSEHOLD_ID)).thenReturn(Optional.empty());
        when(planLimitRegistry.effectiveTier(HOUSEHOLD_ID)).thenReturn("premium");

        UsageSnapshotDto snapshot = usageLedgerService.getUsage(HOUSEHOLD_ID);

        assertThat(snapshot.isUnrestricted()).isTrue();
        assertThat(snapshot.getMetrics()).allSatisfy(m -> {
            assertThat(m.getUsed()).isZero();
            assertThat(m.getLimit()).isNull();
        });
        verify(planLimitRegistry, never()).limitsFor(any());
    }

    @Test
    @DisplayName("실패: 없는 가구는 HOUSEHOLD_NOT_FOUND")
    void getUsage_notFound() {
        when(householdRepository.existsById(HOUSEHOLD_ID)).thenReturn(false);

        assertThatThrownBy(() -> usageLedgerService.getUsage(HOUSEHOLD_ID))
                .isInstanceOf(CustomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.HOUSEHOLD_NOT_FOUND);
    }
}
