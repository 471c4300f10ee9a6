package com.jdc.ledger_service.domain.entity.household;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "household_entitlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class HouseholdEntitlement {

    @Id
    @Column(name = "household_id")
    private Long householdId;

    @Column(nullable = false, length = 30)
    private String tier;

    // null 이면 무기한
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    public boolean isValidAt(LocalDateTime now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
