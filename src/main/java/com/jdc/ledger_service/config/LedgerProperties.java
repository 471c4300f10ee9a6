package com.jdc.ledger_service.config;

import com.jdc.ledger_service.domain.type.UsageMetric;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Getter @Setter
public class LedgerProperties {

    private String timezone = "Asia/Seoul";
    private String defaultTier = "free";
    private Set<String> unrestrictedTiers = new LinkedHashSet<>(Set.of("premium"));
    private int maxBackdateDays = 90;

    /** tier -> metric -> 최대값. plan_limits 테이블에 행이 있으면 그쪽이 우선한다. */
    private Map<String, Map<UsageMetric, Integer>> planLimits = new HashMap<>(Map.of("free", defaultFreeLimits()));

    private Scheduler scheduler = new Scheduler();

    public ZoneId zoneId() { return ZoneId.of(timezone); }

    public boolean isUnrestricted(String tier) {
        return unrestrictedTiers.contains(tier);
    }

    private static Map<UsageMetric, Integer> defaultFreeLimits() {
        Map<UsageMetric, Integer> limits = new EnumMap<>(UsageMetric.class);
        limits.put(UsageMetric.ACTIVE_CHORES, 20);
        limits.put(UsageMetric.CHORE_PHOTOS, 15);
        limits.put(UsageMetric.ACTIVE_MEMBERS, 4);
        limits.put(UsageMetric.ACTIVE_EXPENSES, 10);
        limits.put(UsageMetric.ITEM_PHOTOS, 10);
        return limits;
    }

    @Getter @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private String cron = "0 10 0 * * *";
        private int perPlanCap = 31;
        private int totalCap = 500;
        private int pageSize = 100;
    }
}
