package com.jdc.ledger_service.service.chore;

import com.jdc.ledger_service.domain.dto.chore.CursorAdvance;
import com.jdc.ledger_service.domain.entity.chore.Chore;
import com.jdc.ledger_service.domain.entity.common.Recurrence;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * 반복 집안일의 커서를 오늘 이후 첫 회차로 옮긴다.
 * 호출 시점의 커서를 기준으로 n 회차를 한 번에 계산하므로 월말(1/31) 일정이 28/29일로 밀리지 않는다.
 */
@Component
public class ChoreCursorAdvancer {

    public CursorAdvance advance(Chore chore, LocalDate today) {
        if (!chore.isRecurring()) {
            throw new CustomException(ErrorCode.INVALID_RECURRENCE, "반복 집안일이 아닙니다.");
        }
        return advance(chore.currentCursor(), chore.getRecurrence(), today);
    }

    public CursorAdvance advance(LocalDate cursor, Recurrence recurrence, LocalDate today) {
        long steps = recurrence.stepsUntilAfter(cursor, today);
        if (steps == 0) {
            return new CursorAdvance(cursor, 0);
        }
        return new CursorAdvance(recurrence.occurrence(cursor, steps), Math.toIntExact(steps));
    }
}
