package com.jdc.ledger_service.domain.repository.household;

import com.jdc.ledger_service.domain.entity.household.HouseholdMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface HouseholdMemberRepository extends JpaRepository<HouseholdMember, Long> {

    Optional<HouseholdMember> findByHouseholdIdAndUserIdAndCurrentTrue(Long householdId, Long userId);

    @Query("SELECT m.userId FROM HouseholdMember m " +
            "WHERE m.householdId = :householdId AND m.current = true AND m.userId IN :userIds")
    List<Long> findCurrentUserIds(@Param("householdId") Long householdId, @Param("userIds") Collection<Long> userIds);
}
