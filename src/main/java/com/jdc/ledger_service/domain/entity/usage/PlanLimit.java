package com.jdc.ledger_service.domain.entity.usage;

import com.jdc.ledger_service.domain.type.UsageMetric;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "plan_limits",
        uniqueConstraints = @UniqueConstraint(name = "uk_plan_limit_tier_metric", columnNames = {"tier", "metric"}))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlanLimit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 30)
    private String tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private UsageMetric metric;

    @Column(name = "max_value", nullable = false)
    private int maxValue;
}
