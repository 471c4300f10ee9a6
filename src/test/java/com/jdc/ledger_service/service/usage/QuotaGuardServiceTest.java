package com.jdc.ledger_service.service.usage;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.entity.usage.UsageLedger;
import com.jdc.ledger_service.domain.repository.usage.UsageLedgerRepository;
import com.jdc.ledger_service.domain.type.UsageMetric;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import com.jdc.ledger_service.exception.QuotaExceededException;
import com.jdc.ledger_service.service.household.HouseholdLockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotaGuardServiceTest {

    private static final Long HOUSEHOLD_ID = 1L;

    @Mock
    private HouseholdLockService householdLockService;
    @Mock
    private UsageLedgerRepository usageLedgerRepository;
    @Mock
    private PlanLimitRegistry planLimitRegistry;

    private QuotaGuardService quotaGuardService;

    @BeforeEach
    void setUp() {
        quotaGuardService = new QuotaGuardService(householdLockService, usageLedgerRepository, planLimitRegistry, new LedgerProperties());
    }

    private void givenFreeTier(int activeExpenses) {
        when(planLimitRegistry.effectiveTier(HOUSEHOLD_ID)).thenReturn("free");
        when(planLimitRegistry.limitsFor("free")).thenReturn(Map.of(UsageMetric.ACTIVE_EXPENSES, 10));
        when(usageLedgerRepository.findById(HOUSEHOLD_ID)).thenReturn(Optional.of(
                UsageLedger.builder().householdId(HOUSEHOLD_ID).activeExpenses(activeExpenses).build()));
    }

    @Test
    @DisplayName("실패: free 등급 active_expenses 10/10 에서 +1 요청은 QUOTA_EXCEEDED_active_expenses")
    void assertQuota_exceeded() {
        // given
        givenFreeTier(10);

        // when & then
        assertThatThrownBy(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, 1)))
                .isInstanceOf(QuotaExceededException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.QUOTA_EXCEEDED)
                .hasFieldOrPropertyWithValue("symbol", "QUOTA_EXCEEDED_active_expenses")
                .hasFieldOrPropertyWithValue("current", 10)
                .hasFieldOrPropertyWithValue("limit", 10)
                .hasFieldOrPropertyWithValue("projected", 11)
                .hasFieldOrPropertyWithValue("tier", "free");

        verify(usageLedgerRepository, never()).save(any());
    }

    @Test
    @DisplayName("성공: 한도 직전(9/10)에서는 통과하고 카운터는 바뀌지 않는다.")
    void assertQuota_withinLimit() {
        givenFreeTier(9);

        assertThatCode(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, 1)))
                .doesNotThrowAnyException();

        verify(usageLedgerRepository, never()).save(any());
    }

    @Test
    @DisplayName("성공: 감소분은 이미 한도를 넘은 상태여도 검사하지 않는다.")
    void assertQuota_negativeDeltaIgnored() {
        givenFreeTier(12);

        assertThatCode(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, -1)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("성공: premium 등급은 한도 조회 없이 통과")
    void assertQuota_unrestrictedTier() {
        when(planLimitRegistry.effectiveTier(HOUSEHOLD_ID)).thenReturn("premium");

        quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, 100));

        verify(planLimitRegistry, never()).limitsFor(any());
        verifyNoInteractions(usageLedgerRepository);
    }

    @Test
    @DisplayName("성공: 사용량 행이 없으면 0 으로 보고 계산한다.")
    void assertQuota_missingLedgerReadsAsZero() {
        when(planLimitRegistry.effectiveTier(HOUSEHOLD_ID)).thenReturn("free");
        when(planLimitRegistry.limitsFor("free")).thenReturn(Map.of(UsageMetric.ACTIVE_MEMBERS, 4));
        when(usageLedgerRepository.findById(HOUSEHOLD_ID)).thenReturn(Optional.empty());

        assertThatCode(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_MEMBERS, 4)))
                .doesNotThrowAnyException();

        assertThatThrownBy(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_MEMBERS, 5)))
                .isInstanceOf(QuotaExceededException.class)
                .hasFieldOrPropertyWithValue("current", 0)
                .hasFieldOrPropertyWithValue("projected", 5);
    }

    @Test
    @DisplayName("성공: 한도가 등록되지 않은 지표는 무제한")
    void assertQuota_unregisteredMetricIsUnlimited() {
        givenFreeTier(0);

        assertThatCode(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.CHORE_PHOTOS, 1000)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("실패: 비활성 가구는 TENANT_INACTIVE")
    void assertQuota_inactiveHousehold() {
        when(householdLockService.lockActive(HOUSEHOLD_ID)).thenThrow(new CustomException(ErrorCode.TENANT_INACTIVE));

        assertThatThrownBy(() -> quotaGuardService.assertQuota(HOUSEHOLD_ID, Map.of(UsageMetric.ACTIVE_EXPENSES, 1)))
                .isInstanceOf(CustomException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TENANT_INACTIVE);

        verifyNoInteractions(planLimitRegistry, usageLedgerRepository);
    }
}
