package com.jdc.ledger_service.service.usage;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.entity.usage.UsageLedger;
import com.jdc.ledger_service.domain.repository.usage.UsageLedgerRepository;
import com.jdc.ledger_service.domain.type.UsageMetric;
import com.jdc.ledger_service.exception.QuotaExceededException;
import com.jdc.ledger_service.service.household.HouseholdLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaGuardService {

    private final HouseholdLockService householdLockService;
    private final UsageLedgerRepository usageLedgerRepository;
    private final PlanLimitRegistry planLimitRegistry;
    private final LedgerProperties props;

    /**
     * 증가분만 검사한다. 감소분은 통과, 사용량은 변경하지 않는다.
     * 가구 락은 호출한 트랜잭션이 끝날 때까지 유지되므로 뒤이은 생성과 원자적으로 묶인다.
     */
    @Transactional
    public void assertQuota(Long householdId, Map<UsageMetric, Integer> deltas) {
        householdLockService.lockActive(householdId);

        String tier = planLimitRegistry.effectiveTier(householdId);
        if (props.isUnrestricted(tier)) {
            return;
        }

        Map<UsageMetric, Integer> limits = planLimitRegistry.limitsFor(tier);
        UsageLedger ledger = usageLedgerRepository.findById(householdId)
                .orElseGet(() -> UsageLedger.empty(householdId));

        for (UsageMetric metric : UsageMetric.values()) {
            Integer delta = deltas.get(metric);
            if (delta == null || delta <= 0) continue;

            Integer limit = limits.get(metric);
            if (limit == null) continue;

            int current = ledger.get(metric);
            int projected = (int) Math.max(0, Math.min((long) current + delta, Integer.MAX_VALUE));
            if (projected > limit) {
                log.info("한도 초과 차단: householdId={}, metric={}, current={}, limit={}, tier={}",
                        householdId, metric.getKey(), current, limit, tier);
                throw new QuotaExceededException(metric, current, limit, projected, tier);
            }
        }
    }
}
