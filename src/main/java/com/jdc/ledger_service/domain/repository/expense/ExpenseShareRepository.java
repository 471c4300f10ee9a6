package com.jdc.ledger_service.domain.repository.expense;

import com.jdc.ledger_service.domain.entity.expense.ExpenseShare;
import com.jdc.ledger_service.domain.type.ShareStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ExpenseShareRepository extends JpaRepository<ExpenseShare, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ExpenseShare s " +
            "WHERE s.expenseId IN :expenseIds AND s.participantId = :participantId AND s.status = :status " +
            "ORDER BY s.id ASC")
    List<ExpenseShare> findForUpdate(@Param("expenseIds") Collection<Long> expenseIds,
                                     @Param("participantId") Long participantId,
                                     @Param("status") ShareStatus status);

    long countByExpenseIdAndStatus(Long expenseId, ShareStatus status);

    List<ExpenseShare> findAllByExpenseIdOrderByParticipantIdAsc(Long expenseId);
}
