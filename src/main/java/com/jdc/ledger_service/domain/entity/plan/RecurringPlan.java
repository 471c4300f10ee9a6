package com.jdc.ledger_service.domain.entity.plan;

import com.jdc.ledger_service.domain.entity.common.BaseTimeEntity;
import com.jdc.ledger_service.domain.entity.common.Recurrence;
import com.jdc.ledger_service.domain.type.PlanStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "recurring_plans", indexes = {
        @Index(name = "idx_recurring_plan_due", columnList = "status, next_due_date"),
        @Index(name = "idx_recurring_plan_household", columnList = "household_id, status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecurringPlan extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false)
    private Long householdId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Embedded
    private Recurrence recurrence;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "next_due_date", nullable = false)
    private LocalDate nextDueDate;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Column(length = 255)
    private String description;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PlanStatus status = PlanStatus.ACTIVE;

    @Column(name = "terminated_at")
    private LocalDateTime terminatedAt;

    @Builder.Default
    @OneToMany(mappedBy = "plan", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("participantId ASC")
    private List<PlanShare> shares = new ArrayList<>();

    public void addShare(Long participantId, long shareAmountCents) {
        shares.add(PlanShare.builder()
                .plan(this)
                .participantId(participantId)
                .shareAmountCents(shareAmountCents)
                .build());
    }

    public boolean isActive() {
        return status == PlanStatus.ACTIVE;
    }

    public boolean involves(Long memberId) {
        return ownerId.equals(memberId)
                || shares.stream().anyMatch(s -> s.getParticipantId().equals(memberId));
    }

    /** 시작일 기준 격자에서 cycleDate 다음 회차. */
    public LocalDate cycleAfter(LocalDate cycleDate) {
        return recurrence.firstOccurrenceAfter(startDate, cycleDate);
    }

    public void advanceNextDueDate(LocalDate nextDueDate) {
        if (nextDueDate.isBefore(this.nextDueDate)) {
            throw new IllegalStateException("next_due_date 는 되돌릴 수 없습니다: " + this.nextDueDate + " -> " + nextDueDate);
        }
        this.nextDueDate = nextDueDate;
    }

    /** @return 이번 호출로 상태가 바뀌었으면 true */
    public boolean terminate(LocalDateTime now) {
        if (status == PlanStatus.TERMINATED) {
            return false;
        }
        this.status = PlanStatus.TERMINATED;
        this.terminatedAt = now;
        return true;
    }
}
