package com.jdc.ledger_service.domain.repository.plan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
@Profile("prod")
@RequiredArgsConstructor
@Slf4j
public class MySqlDuePlanClaimDao implements DuePlanClaimDao {

    private final JdbcTemplate jdbc;

    @Override
    public boolean tryLockHousehold(Long householdId) {
        List<Long> locked = jdbc.queryForList(
                """
                SELECT id FROM households
                WHERE id = ? AND is_active = TRUE
                FOR UPDATE SKIP LOCKED
                """,
                Long.class, householdId
        );
        if (locked.isEmpty()) {
            log.debug("-> 가구 선점 실패 (잠겨 있거나 비활성) householdId={}", householdId);
            return false;
        }
        return true;
    }

    @Override
    public boolean tryClaim(Long planId, LocalDate today) {
        List<Long> claimed = jdbc.queryForList(
                """
                SELECT id FROM recurring_plans
                WHERE id = ? AND status = 'ACTIVE' AND next_due_date <= ?
                FOR UPDATE SKIP LOCKED
                """,
                Long.class, planId, today
        );
        if (claimed.isEmpty()) {
            log.debug("-> 선점 실패 (잠겨 있거나 이미 처리됨) planId={}", planId);
            return false;
        }
        return true;
    }
}
