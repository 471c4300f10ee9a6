package com.jdc.ledger_service.scheduler;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.dto.scheduler.DueCycleRunSummary;
import com.jdc.ledger_service.service.plan.DueCycleBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@Component
@RequiredArgsConstructor
@Slf4j
public class DueCycleScheduler {

    private final DueCycleBatchService dueCycleBatchService;
    private final LedgerProperties props;
    private final Clock clock;

    // 매일 00:10 (ledger.timezone 기준) 도래한 반복 지출 회차 생성
    @Scheduled(cron = "${ledger.scheduler.cron:0 10 0 * * *}", zone = "${ledger.timezone:Asia/Seoul}")
    public void runDueCycles() {
        if (!props.getScheduler().isEnabled()) {
            log.debug("[Scheduler] 반복 지출 스케줄러 비활성화 상태");
            return;
        }

        LocalDate today = LocalDate.now(clock);
        log.info("[Scheduler] 반복 지출 회차 생성 시작: {}", today);
        DueCycleRunSummary summary = dueCycleBatchService.runDueCycles(today);
        log.info("[Scheduler] 반복 지출 회차 생성 종료: 생성 {}건, 실패 {}건",
                summary.getCyclesCreated(), summary.getPlansFailed());
    }
}
