package com.jdc.ledger_service.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 멤버십 쪽에서 구성원이 가구를 떠나거나 제외될 때 발행한다.
 */
@RequiredArgsConstructor
@Getter
public class ParticipantRemovedEvent {
    private final Long householdId;
    private final Long participantId;
}
