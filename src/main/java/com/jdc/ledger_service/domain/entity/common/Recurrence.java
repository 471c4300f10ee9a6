package com.jdc.ledger_service.domain.entity.common;

import com.jdc.ledger_service.domain.entity.converter.RecurrenceUnitConverter;
import com.jdc.ledger_service.domain.type.RecurrenceUnit;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 반복 주기 (every x unit).
 * 회차 날짜는 항상 기준일(anchor)에서 every * n 만큼 더해서 구한다.
 * 직전 회차에서 이어 더하면 월말 기준 일정이 28/29일로 밀리기 때문.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode
public class Recurrence {

    @Column(name = "recurrence_every")
    private Integer every;

    @Convert(converter = RecurrenceUnitConverter.class)
    @Column(name = "recurrence_unit", length = 10)
    private RecurrenceUnit unit;

    private Recurrence(int every, RecurrenceUnit unit) {
        this.every = every;
        this.unit = unit;
    }

    public static Recurrence of(Integer every, RecurrenceUnit unit) {
        if (every == null || unit == null) {
            throw new CustomException(ErrorCode.INVALID_RECURRENCE, "반복 주기(every)와 단위(unit)는 함께 지정해야 합니다.");
        }
        if (every < 1) {
            throw new CustomException(ErrorCode.INVALID_RECURRENCE, "반복 주기(every)는 1 이상이어야 합니다.");
        }
        return new Recurrence(every, unit);
    }

    public LocalDate occurrence(LocalDate anchor, long index) {
        return unit.addTo(anchor, (long) every * index);
    }

    public LocalDate next(LocalDate from) {
        return occurrence(from, 1);
    }

    /**
     * anchor 기준 회차 중 date 보다 뒤에 오는 첫 회차의 순번.
     * anchor 자체가 date 이후라면 0.
     */
    public long stepsUntilAfter(LocalDate anchor, LocalDate date) {
        if (anchor.isAfter(date)) {
            return 0;
        }
        long index = Math.max(0, estimateIndex(anchor, date));
        while (!occurrence(anchor, index).isAfter(date)) {
            index++;
        }
        return index;
    }

    public LocalDate firstOccurrenceAfter(LocalDate anchor, LocalDate date) {
        return occurrence(anchor, stepsUntilAfter(anchor, date));
    }

    // 내림 계산이라 실제 회차를 넘어서지 않는다. 나머지는 호출부 루프가 맞춘다.
    private long estimateIndex(LocalDate anchor, LocalDate date) {
        return switch (unit) {
            case DAY -> ChronoUnit.DAYS.between(anchor, date) / every;
            case WEEK -> ChronoUnit.DAYS.between(anchor, date) / (7L * every);
            case MONTH -> ChronoUnit.MONTHS.between(anchor, date) / every;
            case YEAR -> ChronoUnit.YEARS.between(anchor, date) / every;
        };
    }
}
