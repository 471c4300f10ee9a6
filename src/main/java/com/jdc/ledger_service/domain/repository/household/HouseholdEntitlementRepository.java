package com.jdc.ledger_service.domain.repository.household;

import com.jdc.ledger_service.domain.entity.household.HouseholdEntitlement;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HouseholdEntitlementRepository extends JpaRepository<HouseholdEntitlement, Long> {
}
