package com.jdc.ledger_service.domain.entity.plan;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "recurring_plan_shares",
        uniqueConstraints = @UniqueConstraint(name = "uk_plan_share_participant", columnNames = {"plan_id", "participant_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class PlanShare {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_id", nullable = false)
    private RecurringPlan plan;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(name = "share_amount_cents", nullable = false)
    private long shareAmountCents;
}
