package com.jdc.ledger_service.domain.entity.household;

import com.jdc.ledger_service.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * 멤버십 서비스가 관리하는 구성원 정보의 읽기 모델.
 */
@Entity
@Table(name = "household_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_household_member", columnNames = {"household_id", "user_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class HouseholdMember extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false)
    private Long householdId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Builder.Default
    @Column(name = "is_current", nullable = false)
    private boolean current = true;

    @Column(name = "joined_on", nullable = false)
    private LocalDate joinedOn;

    public void leave() {
        this.current = false;
    }
}
