package com.jdc.ledger_service.domain.repository.plan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
@Profile("!prod")
@RequiredArgsConstructor
@Slf4j
public class H2DuePlanClaimDao implements DuePlanClaimDao {

    private final JdbcTemplate jdbc;

    // H2 는 NOWAIT 으로 잠가 이미 잡힌 행이면 즉시 실패시킨다. 실패한 문장만 무효라 트랜잭션은 계속 쓸 수 있다.
    @Override
    public boolean tryLockHousehold(Long householdId) {
        try {
            List<Long> locked = jdbc.queryForList(
                    """
                    SELECT id FROM households
                    WHERE id = ? AND is_active = TRUE
                    FOR UPDATE NOWAIT
                    """,
                    Long.class, householdId
            );
            return !locked.isEmpty();
        } catch (PessimisticLockingFailureException e) {
            log.debug("-> 가구 선점 실패 (다른 트랜잭션이 잠금) householdId={}", householdId);
            return false;
        }
    }

    // 가구를 먼저 잡은 뒤라 플랜 행은 일반 FOR UPDATE 로 충분하다.
    @Override
    public boolean tryClaim(Long planId, LocalDate today) {
        List<Long> claimed = jdbc.queryForList(
                """
                SELECT id FROM recurring_plans
                WHERE id = ? AND status = 'ACTIVE' AND next_due_date <= ?
                FOR UPDATE
                """,
                Long.class, planId, today
        );
        return !claimed.isEmpty();
    }
}
