package com.jdc.ledger_service.domain.entity.expense;

import com.jdc.ledger_service.domain.entity.common.BaseTimeEntity;
import com.jdc.ledger_service.domain.type.ExpenseStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 반복 지출의 한 회차. (plan_id, due_date) 가 생성 멱등 키.
 * 행 삽입은 ExpenseCycleDao 가 담당하고, 엔티티는 조회와 정산 갱신에만 쓴다.
 */
@Entity
@Table(name = "expenses",
        uniqueConstraints = @UniqueConstraint(name = "uk_expense_plan_due", columnNames = {"plan_id", "due_date"}),
        indexes = @Index(name = "idx_expense_owner_status", columnList = "owner_id, status"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Expense extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false)
    private Long householdId;

    @Column(name = "plan_id")
    private Long planId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Column(length = 255)
    private String description;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExpenseStatus status = ExpenseStatus.ACTIVE;

    @Column(name = "fully_paid_at")
    private LocalDateTime fullyPaidAt;

    public boolean isFullyPaid() {
        return fullyPaidAt != null;
    }

    /** @return 이번 호출로 처음 완납 처리되었으면 true */
    public boolean markFullyPaid(LocalDateTime now) {
        if (fullyPaidAt != null) {
            return false;
        }
        this.fullyPaidAt = now;
        return true;
    }
}
