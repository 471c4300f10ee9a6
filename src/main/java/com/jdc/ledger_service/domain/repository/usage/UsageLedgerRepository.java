package com.jdc.ledger_service.domain.repository.usage;

import com.jdc.ledger_service.domain.entity.usage.UsageLedger;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UsageLedgerRepository extends JpaRepository<UsageLedger, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM UsageLedger u WHERE u.householdId = :householdId")
    Optional<UsageLedger> findByIdForUpdate(@Param("householdId") Long householdId);
}
