package com.jdc.ledger_service.service.plan;

import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.repository.plan.RecurringPlanRepository;
import com.jdc.ledger_service.domain.type.PlanStatus;
import com.jdc.ledger_service.service.household.HouseholdLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 구성원이 빠지면 그 사람이 소유하거나 분담하는 활성 플랜을 모두 종료한다.
 * 가구 비활성 여부는 보지 않는다. 탈퇴 처리 쪽에서 이미 확인한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanTerminationCascade {

    private final RecurringPlanRepository recurringPlanRepository;
    private final HouseholdLockService householdLockService;
    private final Clock clock;

    @Transactional
    public List<Long> onParticipantRemoved(Long householdId, Long participantId) {
        householdLockService.lock(householdId);

        List<Long> candidateIds = recurringPlanRepository.findPlanIdsInvolving(householdId, participantId, PlanStatus.ACTIVE);
        if (candidateIds.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> terminated = new ArrayList<>();
        for (RecurringPlan plan : recurringPlanRepository.findAllByIdInForUpdate(candidateIds)) {
            // 락을 잡은 뒤 다시 확인
            if (!householdId.equals(plan.getHouseholdId()) || !plan.involves(participantId)) continue;
            if (plan.terminate(now)) {
                terminated.add(plan.getId());
            }
        }

        if (!terminated.isEmpty()) {
            log.info("구성원 변경으로 반복 지출 종료: householdId={}, participantId={}, plans={}",
                    householdId, participantId, terminated);
        }
        return terminated;
    }
}
