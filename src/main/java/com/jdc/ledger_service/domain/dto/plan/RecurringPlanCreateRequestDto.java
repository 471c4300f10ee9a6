package com.jdc.ledger_service.domain.dto.plan;

import com.jdc.ledger_service.domain.type.RecurrenceUnit;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class RecurringPlanCreateRequestDto {

    @NotNull(message = "반복 주기는 필수입니다.")
    @Positive(message = "반복 주기는 1 이상이어야 합니다.")
    private Integer every;

    @NotNull(message = "반복 단위는 필수입니다.")
    private RecurrenceUnit unit;

    @NotNull(message = "시작일은 필수입니다.")
    private LocalDate startDate;

    @NotNull
    @Positive(message = "금액은 0보다 커야 합니다.")
    private Long amountCents;

    @Size(max = 255)
    private String description;

    @Valid
    @NotEmpty(message = "분담 내역은 필수입니다.")
    private List<PlanShareRequestDto> shares;
}
