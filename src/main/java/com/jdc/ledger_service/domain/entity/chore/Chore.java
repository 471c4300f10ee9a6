package com.jdc.ledger_service.domain.entity.chore;

import com.jdc.ledger_service.domain.entity.common.BaseTimeEntity;
import com.jdc.ledger_service.domain.entity.common.Recurrence;
import com.jdc.ledger_service.domain.type.ChoreState;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 반복 집안일은 행을 새로 만들지 않고 recurrence_cursor 를 앞으로 옮긴다.
 * recurrence 가 null 이면 일회성.
 */
@Entity
@Table(name = "chores", indexes = @Index(name = "idx_chore_household_state", columnList = "household_id, state"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Chore extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false)
    private Long householdId;

    @Column(name = "assignee_id")
    private Long assigneeId;

    @Column(length = 100)
    private String name;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "recurrence_cursor")
    private LocalDate recurrenceCursor;

    @Embedded
    private Recurrence recurrence;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChoreState state = ChoreState.ACTIVE;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public boolean isRecurring() {
        return recurrence != null && recurrence.getEvery() != null && recurrence.getUnit() != null;
    }

    public LocalDate currentCursor() {
        return recurrenceCursor != null ? recurrenceCursor : startDate;
    }

    public void moveCursor(LocalDate cursor, LocalDateTime now) {
        this.recurrenceCursor = cursor;
        this.completedAt = now;
    }

    public void complete(LocalDateTime now) {
        this.state = ChoreState.COMPLETED;
        this.recurrenceCursor = null;
        this.completedAt = now;
    }
}
