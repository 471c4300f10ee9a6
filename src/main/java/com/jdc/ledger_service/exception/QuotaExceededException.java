package com.jdc.ledger_service.exception;

import com.jdc.ledger_service.domain.type.UsageMetric;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요금제 한도 초과. 기호 이름은 QUOTA_EXCEEDED_{metric} (예: QUOTA_EXCEEDED_active_expenses).
 */
@Getter
public class QuotaExceededException extends CustomException {

    private final UsageMetric metric;
    private final int current;
    private final int limit;
    private final int projected;
    private final String tier;

    public QuotaExceededException(UsageMetric metric, int current, int limit, int projected, String tier) {
        super(ErrorCode.QUOTA_EXCEEDED,
                String.format("%s 한도를 초과했습니다. (현재 %d, 한도 %d, 요청 후 %d)", metric.getKey(), current, limit, projected));
        this.metric = metric;
        this.current = current;
        this.limit = limit;
        this.projected = projected;
        this.tier = tier;
    }

    @Override
    public String getSymbol() {
        return "QUOTA_EXCEEDED_" + metric.getKey();
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("metric", metric.getKey());
        details.put("current", current);
        details.put("limit", limit);
        details.put("projected", projected);
        details.put("tier", tier);
        return details;
    }
}
