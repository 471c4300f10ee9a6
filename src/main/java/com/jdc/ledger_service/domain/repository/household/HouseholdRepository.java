package com.jdc.ledger_service.domain.repository.household;

import com.jdc.ledger_service.domain.entity.household.Household;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface HouseholdRepository extends JpaRepository<Household, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM Household h WHERE h.id = :id")
    Optional<Household> findByIdForUpdate(@Param("id") Long id);

    // 여러 가구를 잠글 때는 항상 id 오름차순
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM Household h WHERE h.id IN :ids ORDER BY h.id ASC")
    List<Household> findAllByIdInForUpdate(@Param("ids") Collection<Long> ids);
}
