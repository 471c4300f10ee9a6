package com.jdc.ledger_service.domain.entity.expense;

import com.jdc.ledger_service.domain.type.ShareStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "expense_shares",
        uniqueConstraints = @UniqueConstraint(name = "uk_expense_share_participant", columnNames = {"expense_id", "participant_id"}),
        indexes = @Index(name = "idx_expense_share_debtor", columnList = "participant_id, status"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ExpenseShare {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "expense_id", nullable = false)
    private Long expenseId;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ShareStatus status = ShareStatus.UNPAID;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    public static ExpenseShare unpaid(Long expenseId, Long participantId, long amountCents) {
        return ExpenseShare.builder()
                .expenseId(expenseId)
                .participantId(participantId)
                .amountCents(amountCents)
                .build();
    }

    // 지출 등록자 본인 몫은 처음부터 정산된 것으로 본다.
    public static ExpenseShare settled(Long expenseId, Long participantId, long amountCents, LocalDateTime now) {
        return ExpenseShare.builder()
                .expenseId(expenseId)
                .participantId(participantId)
                .amountCents(amountCents)
                .status(ShareStatus.PAID)
                .paidAt(now)
                .build();
    }

    public boolean isPaid() {
        return status == ShareStatus.PAID;
    }

    public boolean markPaid(LocalDateTime now) {
        if (isPaid()) {
            return false;
        }
        this.status = ShareStatus.PAID;
        this.paidAt = now;
        return true;
    }
}
