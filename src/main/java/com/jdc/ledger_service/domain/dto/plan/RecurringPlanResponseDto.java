package com.jdc.ledger_service.domain.dto.plan;

import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.type.PlanStatus;
import com.jdc.ledger_service.domain.type.RecurrenceUnit;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Getter
@Builder
public class RecurringPlanResponseDto {
    private Long id;
    private Long householdId;
    private Long ownerId;
    private Integer every;
    private RecurrenceUnit unit;
    private LocalDate startDate;
    private LocalDate nextDueDate;
    private long amountCents;
    private String description;
    private PlanStatus status;
    private LocalDateTime terminatedAt;
    private List<PlanShareRequestDto> shares;

    public static RecurringPlanResponseDto from(RecurringPlan plan) {
        return RecurringPlanResponseDto.builder()
                .id(plan.getId())
                .householdId(plan.getHouseholdId())
                .ownerId(plan.getOwnerId())
                .every(plan.getRecurrence().getEvery())
                .unit(plan.getRecurrence().getUnit())
                .startDate(plan.getStartDate())
                .nextDueDate(plan.getNextDueDate())
                .amountCents(plan.getAmountCents())
                .description(plan.getDescription())
                .status(plan.getStatus())
                .terminatedAt(plan.getTerminatedAt())
                .shares(plan.getShares().stream()
                        .map(s -> new PlanShareRequestDto(s.getParticipantId(), s.getShareAmountCents()))
                        .toList())
                .build();
    }
}
