package com.jdc.ledger_service.domain.dto.usage;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class UsageSnapshotDto {
    private Long householdId;
    private String tier;
    private boolean unrestricted;
    private List<MetricUsageDto> metrics;
}
