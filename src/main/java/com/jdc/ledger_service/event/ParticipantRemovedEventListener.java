package com.jdc.ledger_service.event;

import com.jdc.ledger_service.service.plan.PlanTerminationCascade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ParticipantRemovedEventListener {

    private final PlanTerminationCascade planTerminationCascade;

    // 발행한 트랜잭션 안에서 동기로 처리해야 탈퇴와 플랜 종료가 함께 커밋된다.
    @EventListener
    public void onParticipantRemoved(ParticipantRemovedEvent event) {
        log.info("구성원 제외 이벤트 수신: householdId={}, participantId={}", event.getHouseholdId(), event.getParticipantId());
        planTerminationCascade.onParticipantRemoved(event.getHouseholdId(), event.getParticipantId());
    }
}
