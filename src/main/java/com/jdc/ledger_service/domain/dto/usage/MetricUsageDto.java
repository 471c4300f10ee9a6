package com.jdc.ledger_service.domain.dto.usage;

import com.jdc.ledger_service.domain.type.UsageMetric;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class MetricUsageDto {
    private UsageMetric metric;
    private int used;
    // null 이면 무제한
    private Integer limit;
    private Integer remaining;

    public static MetricUsageDto of(UsageMetric metric, int used, Integer limit) {
        return MetricUsageDto.builder()
                .metric(metric)
                .used(used)
                .limit(limit)
                .remaining(limit == null ? null : Math.max(0, limit - used))
                .build();
    }
}
