package com.jdc.ledger_service.domain.repository.chore;

import com.jdc.ledger_service.domain.entity.chore.Chore;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ChoreRepository extends JpaRepository<Chore, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Chore c WHERE c.id = :id")
    Optional<Chore> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT c.householdId FROM Chore c WHERE c.id = :id")
    Optional<Long> findHouseholdIdById(@Param("id") Long id);
}
