package com.jdc.ledger_service.service.plan;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.dto.plan.MaterializationResult;
import com.jdc.ledger_service.domain.dto.scheduler.PlanCycleOutcome;
import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.repository.plan.DuePlanClaimDao;
import com.jdc.ledger_service.domain.repository.plan.RecurringPlanRepository;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 스케줄러에서 플랜 하나를 처리한다. 플랜마다 새 트랜잭션이라 한 플랜의 실패가 다른 플랜에 번지지 않는다.
 * Retry 가 트랜잭션 바깥에서 감싸므로 재시도마다 새 트랜잭션으로 시작한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuePlanProcessor {

    private final RecurringPlanRepository recurringPlanRepository;
    private final DuePlanClaimDao duePlanClaimDao;
    private final CycleMaterializer cycleMaterializer;
    private final LedgerProperties props;

    @Retry(name = "dueCycle")
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PlanCycleOutcome process(Long planId, LocalDate today, int remainingBudget) {
        Optional<Long> householdId = recurringPlanRepository.findHouseholdIdById(planId);
        // 다른 실행이나 요청이 잡고 있는 가구는 기다리지 않고 다음 실행으로 넘긴다.
        if (householdId.isEmpty() || !duePlanClaimDao.tryLockHousehold(householdId.get())) {
            return PlanCycleOutcome.skipped(planId);
        }

        if (!duePlanClaimDao.tryClaim(planId, today)) {
            return PlanCycleOutcome.skipped(planId);
        }

        RecurringPlan plan = recurringPlanRepository.findById(planId).orElse(null);
        if (plan == null || !householdId.get().equals(plan.getHouseholdId())) {
            return PlanCycleOutcome.skipped(planId);
        }

        int cap = Math.min(props.getScheduler().getPerPlanCap(), remainingBudget);
        int created = 0;
        int replayed = 0;
        LocalDate cycleDate = plan.getNextDueDate();

        while (!cycleDate.isAfter(today) && created + replayed < cap) {
            MaterializationResult result = cycleMaterializer.materialize(planId, cycleDate);
            if (result.isCreated()) {
                created++;
            } else {
                replayed++;
                log.warn("-> 이미 존재하는 회차 재사용 planId={}, dueDate={}", planId, cycleDate);
            }
            cycleDate = plan.cycleAfter(cycleDate);
        }

        plan.advanceNextDueDate(cycleDate);

        if (!cycleDate.isAfter(today)) {
            log.warn("-> 회차 생성 상한 도달 planId={}, 남은 다음 회차={}", planId, cycleDate);
        }
        return new PlanCycleOutcome(planId, true, created, replayed, cycleDate);
    }
}
