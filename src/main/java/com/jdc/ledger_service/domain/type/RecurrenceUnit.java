package com.jdc.ledger_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;

@Getter
@RequiredArgsConstructor
public enum RecurrenceUnit {

    DAY("day"),
    WEEK("week"),
    // 월/연 단위는 달력 기준으로 더한다. (1/31 + 1개월 = 2월 말일)
    MONTH("month"),
    YEAR("year");

    @JsonValue
    private final String key;

    public LocalDate addTo(LocalDate date, long amount) {
        return switch (this) {
            case DAY -> date.plusDays(amount);
            case WEEK -> date.plusWeeks(amount);
            case MONTH -> date.plusMonths(amount);
            case YEAR -> date.plusYears(amount);
        };
    }

    @JsonCreator
    public static RecurrenceUnit fromKey(String key) {
        if (key == null) return null;
        for (RecurrenceUnit unit : values()) {
            if (unit.key.equalsIgnoreCase(key) || unit.name().equalsIgnoreCase(key)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unsupported recurrence unit: " + key);
    }
}
