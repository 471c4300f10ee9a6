package com.jdc.ledger_service.domain.repository.expense;

import com.jdc.ledger_service.domain.entity.expense.Expense;
import com.jdc.ledger_service.domain.type.ExpenseStatus;
import com.jdc.ledger_service.domain.type.ShareStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ExpenseRepository extends JpaRepository<Expense, Long> {

    // 잠금 읽기라야 REPEATABLE READ 스냅샷에 가려진 다른 트랜잭션의 행이 보인다.
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT e FROM Expense e WHERE e.planId = :planId AND e.dueDate = :dueDate")
    Optional<Expense> findByPlanIdAndDueDateForShare(@Param("planId") Long planId, @Param("dueDate") LocalDate dueDate);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Expense e WHERE e.id IN :ids ORDER BY e.id ASC")
    List<Expense> findAllByIdInForUpdate(@Param("ids") Collection<Long> ids);

    List<Expense> findAllByPlanIdOrderByDueDateAsc(Long planId);

    /**
     * debtor 가 recipient 에게 아직 갚지 않은 몫이 남은 지출의 (id, household_id).
     * debtor 가 더 이상 구성원이 아닌 가구의 지출은 제외한다.
     */
    @Query("SELECT DISTINCT e.id, e.householdId FROM Expense e, ExpenseShare s, Household h, HouseholdMember m " +
            "WHERE s.expenseId = e.id AND h.id = e.householdId AND h.active = true " +
            "AND m.householdId = e.householdId AND m.userId = :debtorId AND m.current = true " +
            "AND e.ownerId = :recipientId AND e.status = :expenseStatus AND e.fullyPaidAt IS NULL " +
            "AND s.participantId = :debtorId AND s.status = :shareStatus " +
            "ORDER BY e.id ASC")
    List<Object[]> findSettlementTargets(@Param("debtorId") Long debtorId,
                                         @Param("recipientId") Long recipientId,
                                         @Param("expenseStatus") ExpenseStatus expenseStatus,
                                         @Param("shareStatus") ShareStatus shareStatus);
}
