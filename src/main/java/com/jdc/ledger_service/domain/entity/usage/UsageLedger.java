package com.jdc.ledger_service.domain.entity.usage;

import com.jdc.ledger_service.domain.type.UsageMetric;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 가구별 사용량 카운터. 모든 값은 0 이상으로 유지된다.
 * 가구 행 락을 잡은 상태에서만 UsageLedgerService 를 통해 변경한다.
 */
@Entity
@Table(name = "household_usage_counters")
@EntityListeners(AuditingEntityListener.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class UsageLedger {

    @Id
    @Column(name = "household_id")
    private Long householdId;

    @Builder.Default
    @Column(name = "active_chores", nullable = false)
    private int activeChores = 0;

    @Builder.Default
    @Column(name = "chore_photos", nullable = false)
    private int chorePhotos = 0;

    @Builder.Default
    @Column(name = "active_members", nullable = false)
    private int activeMembers = 0;

    @Builder.Default
    @Column(name = "active_expenses", nullable = false)
    private int activeExpenses = 0;

    @Builder.Default
    @Column(name = "item_photos", nullable = false)
    private int itemPhotos = 0;

    @LastModifiedDate
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static UsageLedger empty(Long householdId) {
        return UsageLedger.builder().householdId(householdId).build();
    }

    public int get(UsageMetric metric) {
        return switch (metric) {
            case ACTIVE_CHORES -> activeChores;
            case CHORE_PHOTOS -> chorePhotos;
            case ACTIVE_MEMBERS -> activeMembers;
            case ACTIVE_EXPENSES -> activeExpenses;
            case ITEM_PHOTOS -> itemPhotos;
        };
    }

    public void applyDelta(Map<UsageMetric, Integer> deltas) {
        deltas.forEach((metric, delta) -> {
            if (delta != null && delta != 0) {
                set(metric, clamp((long) get(metric) + delta));
            }
        });
    }

    private static int clamp(long value) {
        if (value < 0) return 0;
        return (int) Math.min(value, Integer.MAX_VALUE);
    }

    private void set(UsageMetric metric, int value) {
        switch (metric) {
            case ACTIVE_CHORES -> this.activeChores = value;
            case CHORE_PHOTOS -> this.chorePhotos = value;
            case ACTIVE_MEMBERS -> this.activeMembers = value;
            case ACTIVE_EXPENSES -> this.activeExpenses = value;
            case ITEM_PHOTOS -> this.itemPhotos = value;
        }
    }
}
