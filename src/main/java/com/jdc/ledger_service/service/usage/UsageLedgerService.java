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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class UsageLedgerService {

    private final UsageLedgerRepository usageLedgerRepository;
    private final HouseholdRepository householdRepository;
    private final HouseholdLockService householdLockService;
    private final PlanLimitRegistry planLimitRegistry;
    private final LedgerProperties props;

    /**
     * 사용량 증감. 결과가 음수면 0으로 보정하고, 한도는 여기서 보지 않는다 (QuotaGuardService 담당).
     */
    @Transactional
    public UsageLedger applyDelta(Long householdId, Map<UsageMetric, Integer> deltas) {
        householdLockService.lockActive(householdId);

        UsageLedger ledger = usageLedgerRepository.findByIdForUpdate(householdId)
                .orElseGet(() -> usageLedgerRepository.save(UsageLedger.empty(householdId)));
        ledger.applyDelta(deltas);

        log.debug("사용량 반영: householdId={}, deltas={}", householdId, deltas);
        return ledger;
    }

    @Transactional(readOnly = true)
    public UsageSnapshotDto getUsage(Long householdId) {
        if (!householdRepository.existsById(householdId)) {
            throw new CustomException(ErrorCode.HOUSEHOLD_NOT_FOUND);
        }

        UsageLedger ledger = usageLedgerRepository.findById(householdId)
                .orElseGet(() -> UsageLedger.empty(householdId));
        String tier = planLimitRegistry.effectiveTier(householdId);
        boolean unrestricted = props.isUnrestricted(tier);
        Map<UsageMetric, Integer> limits = unrestricted ? Map.of() : planLimitRegistry.limitsFor(tier);

        List<MetricUsageDto> metrics = Arrays.stream(UsageMetric.values())
                .map(m -> MetricUsageDto.of(m, ledger.get(m), limits.get(m)))
                .toList();

        return UsageSnapshotDto.builder()
                .householdId(householdId)
                .tier(tier)
                .unrestricted(unrestricted)
                .metrics(metrics)
                .build();
    }
}
