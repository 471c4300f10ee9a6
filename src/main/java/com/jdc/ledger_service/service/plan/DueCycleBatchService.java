package com.jdc.ledger_service.service.plan;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.dto.scheduler.DueCycleRunSummary;
import com.jdc.ledger_service.domain.dto.scheduler.PlanCycleOutcome;
import com.jdc.ledger_service.domain.repository.plan.RecurringPlanRepository;
import com.jdc.ledger_service.domain.type.PlanStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DueCycleBatchService {

    private final RecurringPlanRepository recurringPlanRepository;
    private final DuePlanProcessor duePlanProcessor;
    private final LedgerProperties props;

    /**
     * 도래한 반복 지출 회차 일괄 생성
     * - 트랜잭션은 플랜 단위(DuePlanProcessor)로 분리, 여기서는 잡지 않는다.
     * - 한 실행에서 만들 수 있는 회차 수는 totalCap 으로 제한한다.
     */
    public DueCycleRunSummary runDueCycles(LocalDate today) {
        LedgerProperties.Scheduler cfg = props.getScheduler();
        int budget = cfg.getTotalCap();
        long afterId = 0L;

        int processed = 0;
        int created = 0;
        int replayed = 0;
        int skipped = 0;
        int failed = 0;
        boolean exhausted = false;

        log.info("🚀 [Batch] 반복 지출 회차 생성 시작 (기준일: {})", today);

        pages:
        while (true) {
            List<Long> planIds = recurringPlanRepository.findDuePlanIds(
                    PlanStatus.ACTIVE, today, afterId, PageRequest.of(0, cfg.getPageSize()));
            if (planIds.isEmpty()) break;

            for (Long planId : planIds) {
                afterId = planId;
                if (budget <= 0) {
                    exhausted = true;
                    break pages;
                }

                try {
                    PlanCycleOutcome outcome = duePlanProcessor.process(planId, today, budget);
                    if (!outcome.claimed()) {
                        skipped++;
                        continue;
                    }
                    processed++;
                    created += outcome.created();
                    replayed += outcome.replayed();
                    budget -= outcome.cycles();
                } catch (Exception e) {
                    failed++;
                    log.error("❌ [Batch] 회차 생성 실패 planId={}", planId, e);
                }
            }
        }

        if (budget <= 0) {
            exhausted = true;
        }

        log.info("✅ [Batch] 작업 완료! (처리: {}, 생성: {}, 재사용: {}, 건너뜀: {}, 실패: {}, 상한 도달: {})",
                processed, created, replayed, skipped, failed, exhausted);

        return DueCycleRunSummary.builder()
                .runDate(today)
                .plansProcessed(processed)
                .cyclesCreated(created)
                .cyclesReplayed(replayed)
                .plansSkipped(skipped)
                .plansFailed(failed)
                .budgetExhausted(exhausted)
                .build();
    }
}
