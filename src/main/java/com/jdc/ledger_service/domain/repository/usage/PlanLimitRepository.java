package com.jdc.ledger_service.domain.repository.usage;

import com.jdc.ledger_service.domain.entity.usage.PlanLimit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlanLimitRepository extends JpaRepository<PlanLimit, Long> {

    List<PlanLimit> findAllByTier(String tier);
}
