package com.jdc.ledger_service.domain.repository.expense;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * (plan_id, due_date) 유니크 키에 기대는 회차 지출 삽입.
 * JPA 로 넣으면 제약 위반 시 트랜잭션 전체가 롤백 전용이 되므로 JdbcTemplate 을 쓴다.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ExpenseCycleDao {

    private final JdbcTemplate jdbc;

    public record CycleRow(Long householdId, Long planId, Long ownerId, LocalDate dueDate,
                           long amountCents, String description) {
    }

    /**
     * @return 새로 삽입된 지출 id. 같은 회차가 이미 있으면 empty.
     */
    public Optional<Long> insertIfAbsent(CycleRow row, LocalDateTime now) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        Timestamp ts = Timestamp.valueOf(now);
        try {
            jdbc.update(con -> {
                PreparedStatement ps = con.prepareStatement(
                        """
                        INSERT INTO expenses
                            (household_id, plan_id, owner_id, due_date, amount_cents, description, status, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, 'ACTIVE', ?, ?)
                        """,
                        new String[]{"id"});
                ps.setLong(1, row.householdId());
                ps.setLong(2, row.planId());
                ps.setLong(3, row.ownerId());
                ps.setObject(4, row.dueDate());
                ps.setLong(5, row.amountCents());
                ps.setString(6, row.description());
                ps.setTimestamp(7, ts);
                ps.setTimestamp(8, ts);
                return ps;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            log.warn("-> 이미 생성된 회차 (planId: {}, dueDate: {})", row.planId(), row.dueDate());
            return Optional.empty();
        }
        Number key = keyHolder.getKey();
        return Optional.ofNullable(key).map(Number::longValue);
    }
}
