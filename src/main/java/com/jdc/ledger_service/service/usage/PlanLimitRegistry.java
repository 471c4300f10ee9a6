package com.jdc.ledger_service.service.usage;

import com.jdc.ledger_service.config.CacheConfig;
import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.entity.household.HouseholdEntitlement;
import com.jdc.ledger_service.domain.repository.household.HouseholdEntitlementRepository;
import com.jdc.ledger_service.domain.repository.usage.PlanLimitRepository;
import com.jdc.ledger_service.domain.type.UsageMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanLimitRegistry {

    private final PlanLimitRepository planLimitRepository;
    private final HouseholdEntitlementRepository entitlementRepository;
    private final LedgerProperties props;
    private final Clock clock;

    /**
     * 만료되지 않은 이용권의 등급. 이용권이 없거나 만료됐으면 기본 등급(free).
     */
    public String effectiveTier(Long householdId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return entitlementRepository.findById(householdId)
                .filter(e -> e.isValidAt(now))
                .map(HouseholdEntitlement::getTier)
                .orElse(props.getDefaultTier());
    }

    /**
     * 등급별 한도. 설정값 위에 plan_limits 테이블 값을 덮어쓴다.
     * 맵에 없는 지표는 무제한.
     */
    @Cacheable(value = CacheConfig.PLAN_LIMITS, key = "#tier")
    public Map<UsageMetric, Integer> limitsFor(String tier) {
        Map<UsageMetric, Integer> limits = new EnumMap<>(UsageMetric.class);
        Map<UsageMetric, Integer> defaults = props.getPlanLimits().get(tier);
        if (defaults != null) {
            limits.putAll(defaults);
        }
        planLimitRepository.findAllByTier(tier)
                .forEach(l -> limits.put(l.getMetric(), l.getMaxValue()));

        log.debug("등급 한도 로드: tier={}, limits={}", tier, limits);
        return Collections.unmodifiableMap(limits);
    }
}
