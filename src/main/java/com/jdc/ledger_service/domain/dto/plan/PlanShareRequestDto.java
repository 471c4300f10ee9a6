package com.jdc.ledger_service.domain.dto.plan;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class PlanShareRequestDto {

    @NotNull(message = "참여자는 필수입니다.")
    private Long participantId;

    @NotNull
    @Positive(message = "분담 금액은 0보다 커야 합니다.")
    private Long amountCents;
}
