package com.jdc.ledger_service.domain.repository.plan;

import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.type.PlanStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RecurringPlanRepository extends JpaRepository<RecurringPlan, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM RecurringPlan p WHERE p.id = :id")
    Optional<RecurringPlan> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM RecurringPlan p WHERE p.id IN :ids ORDER BY p.id ASC")
    List<RecurringPlan> findAllByIdInForUpdate(@Param("ids") Collection<Long> ids);

    // 락 순서상 가구를 먼저 잠가야 하므로 소속 가구만 먼저 읽는다.
    @Query("SELECT p.householdId FROM RecurringPlan p WHERE p.id = :id")
    Optional<Long> findHouseholdIdById(@Param("id") Long id);

    /**
     * 스케줄러 대상 (keyset 페이지). 활성 가구의 활성 플랜 중 next_due_date 가 지난 것.
     */
    @Query("SELECT p.id FROM RecurringPlan p, Household h " +
            "WHERE h.id = p.householdId AND h.active = true " +
            "AND p.status = :status AND p.nextDueDate <= :today AND p.id > :afterId " +
            "ORDER BY p.id ASC")
    List<Long> findDuePlanIds(@Param("status") PlanStatus status,
                              @Param("today") LocalDate today,
                              @Param("afterId") Long afterId,
                              Pageable pageable);

    @Query("SELECT p.id FROM RecurringPlan p " +
            "WHERE p.householdId = :householdId AND p.status = :status " +
            "AND (p.ownerId = :memberId " +
            "     OR EXISTS (SELECT 1 FROM PlanShare s WHERE s.plan = p AND s.participantId = :memberId)) " +
            "ORDER BY p.id ASC")
    List<Long> findPlanIdsInvolving(@Param("householdId") Long householdId,
                                    @Param("memberId") Long memberId,
                                    @Param("status") PlanStatus status);
}
