package com.jdc.ledger_service.service.plan;

import com.jdc.ledger_service.config.LedgerProperties;
import com.jdc.ledger_service.domain.dto.plan.MaterializationResult;
import com.jdc.ledger_service.domain.dto.plan.PlanActivationResponseDto;
import com.jdc.ledger_service.domain.dto.plan.PlanShareRequestDto;
import com.jdc.ledger_service.domain.dto.plan.PlanTerminationResult;
import com.jdc.ledger_service.domain.dto.plan.RecurringPlanCreateRequestDto;
import com.jdc.ledger_service.domain.dto.plan.RecurringPlanResponseDto;
import com.jdc.ledger_service.domain.entity.common.Recurrence;
import com.jdc.ledger_service.domain.entity.household.HouseholdMember;
import com.jdc.ledger_service.domain.entity.plan.RecurringPlan;
import com.jdc.ledger_service.domain.repository.household.HouseholdMemberRepository;
import com.jdc.ledger_service.domain.repository.plan.RecurringPlanRepository;
import com.jdc.ledger_service.domain.type.UsageMetric;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import com.jdc.ledger_service.service.household.HouseholdLockService;
import com.jdc.ledger_service.service.usage.QuotaGuardService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringPlanService {

    private final RecurringPlanRepository recurringPlanRepository;
    private final HouseholdMemberRepository householdMemberRepository;
    private final HouseholdLockService householdLockService;
    private final QuotaGuardService quotaGuardService;
    private final CycleMaterializer cycleMaterializer;
    private final LedgerProperties props;
    private final Clock clock;

    /**
     * 반복 지출 활성화: 한도 확인 -> 플랜 생성 -> 시작일 회차 생성을 한 트랜잭션에서.
     */
    @Transactional
    public PlanActivationResponseDto activate(Long householdId, Long ownerId, RecurringPlanCreateRequestDto request) {
        quotaGuardService.assertQuota(householdId, Map.of(UsageMetric.ACTIVE_EXPENSES, 1));

        RecurringPlan plan = create(householdId, ownerId, request);
        MaterializationResult firstCycle = cycleMaterializer.materialize(plan.getId(), plan.getStartDate());

        return PlanActivationResponseDto.builder()
                .plan(RecurringPlanResponseDto.from(plan))
                .firstCycle(firstCycle)
                .build();
    }

    @Transactional
    public RecurringPlan create(Long householdId, Long ownerId, RecurringPlanCreateRequestDto request) {
        householdLockService.lockActive(householdId);

        Recurrence recurrence = Recurrence.of(request.getEvery(), request.getUnit());
        if (request.getAmountCents() == null || request.getAmountCents() <= 0) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "금액은 0보다 커야 합니다.");
        }
        if (request.getStartDate() == null) {
            throw new CustomException(ErrorCode.INVALID_START_DATE_RANGE, "시작일은 필수입니다.");
        }
        validateShares(ownerId, request.getAmountCents(), request.getShares());

        HouseholdMember owner = householdMemberRepository.findByHouseholdIdAndUserIdAndCurrentTrue(householdId, ownerId)
                .orElseThrow(() -> new CustomException(ErrorCode.PARTICIPANT_NOT_MEMBER, "요청자가 현재 가구 구성원이 아닙니다."));
        validateParticipantsAreMembers(householdId, request.getShares());
        validateStartDate(owner, request.getStartDate());

        RecurringPlan plan = RecurringPlan.builder()
                .householdId(householdId)
                .ownerId(ownerId)
                .recurrence(recurrence)
                .startDate(request.getStartDate())
                .nextDueDate(recurrence.next(request.getStartDate()))
                .amountCents(request.getAmountCents())
                .description(request.getDescription())
                .build();
        request.getShares().forEach(s -> plan.addShare(s.getParticipantId(), s.getAmountCents()));

        RecurringPlan saved = recurringPlanRepository.save(plan);
        log.info("반복 지출 생성: planId={}, householdId={}, every={} {}, start={}",
                saved.getId(), householdId, recurrence.getEvery(), recurrence.getUnit().getKey(), saved.getStartDate());
        return saved;
    }

    /**
     * 소유자만 종료할 수 있다. 이미 종료된 플랜은 changed=false 로 현재 상태를 돌려준다.
     * 이미 만들어진 회차 지출은 건드리지 않는다.
     */
    @Transactional
    public PlanTerminationResult terminate(Long planId, Long actorId) {
        Long householdId = recurringPlanRepository.findHouseholdIdById(planId)
                .orElseThrow(() -> new CustomException(ErrorCode.PLAN_NOT_FOUND));

        householdLockService.lockActive(householdId);

        RecurringPlan plan = recurringPlanRepository.findByIdForUpdate(planId)
                .orElseThrow(() -> new CustomException(ErrorCode.PLAN_NOT_FOUND));
        if (!householdId.equals(plan.getHouseholdId())) {
            throw new CustomException(ErrorCode.CONCURRENT_MODIFICATION);
        }
        if (!plan.getOwnerId().equals(actorId)) {
            throw new CustomException(ErrorCode.PLAN_NOT_OWNER);
        }

        boolean changed = plan.terminate(LocalDateTime.now(clock));
        if (changed) {
            log.info("반복 지출 종료: planId={}, actorId={}", planId, actorId);
        }
        return PlanTerminationResult.of(plan, changed);
    }

    private void validateShares(Long ownerId, long amountCents, List<PlanShareRequestDto> shares) {
        if (shares == null || shares.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_SHARES, "분담 내역은 필수입니다.");
        }

        Set<Long> participants = new HashSet<>();
        long sum = 0;
        boolean hasDebtor = false;
        for (PlanShareRequestDto share : shares) {
            if (share == null || share.getParticipantId() == null) {
                throw new CustomException(ErrorCode.INVALID_SHARES, "참여자가 비어 있습니다.");
            }
            if (share.getAmountCents() == null || share.getAmountCents() <= 0) {
                throw new CustomException(ErrorCode.INVALID_SHARES, "분담 금액은 0보다 커야 합니다.");
            }
            if (!participants.add(share.getParticipantId())) {
                throw new CustomException(ErrorCode.INVALID_SHARES, "같은 참여자가 중복되었습니다: " + share.getParticipantId());
            }
            if (!share.getParticipantId().equals(ownerId)) {
                hasDebtor = true;
            }
            sum += share.getAmountCents();
        }

        if (!hasDebtor) {
            throw new CustomException(ErrorCode.INVALID_SHARES, "소유자 외 참여자가 최소 한 명 필요합니다.");
        }
        if (sum != amountCents) {
            throw new CustomException(ErrorCode.INVALID_SHARES_SUM,
                    String.format("분담 금액 합(%d)이 총액(%d)과 다릅니다.", sum, amountCents));
        }
    }

    private void validateParticipantsAreMembers(Long householdId, List<PlanShareRequestDto> shares) {
        Set<Long> participantIds = new LinkedHashSet<>();
        shares.forEach(s -> participantIds.add(s.getParticipantId()));

        Set<Long> current = new HashSet<>(householdMemberRepository.findCurrentUserIds(householdId, participantIds));
        participantIds.removeAll(current);
        if (!participantIds.isEmpty()) {
            throw new CustomException(ErrorCode.PARTICIPANT_NOT_MEMBER,
                    "현재 가구 구성원이 아닌 참여자: " + participantIds);
        }
    }

    // 가입일 이전이나 허용 기간(기본 90일)보다 오래된 날짜로는 시작할 수 없다.
    private void validateStartDate(HouseholdMember owner, LocalDate startDate) {
        LocalDate today = LocalDate.now(clock);
        LocalDate backdateLimit = today.minusDays(props.getMaxBackdateDays());
        LocalDate minStartDate = owner.getJoinedOn().isAfter(backdateLimit) ? owner.getJoinedOn() : backdateLimit;

        if (startDate.isBefore(minStartDate)) {
            throw new CustomException(ErrorCode.INVALID_START_DATE_RANGE,
                    String.format("시작일은 %s 이후여야 합니다. (가입일 %s)", minStartDate, owner.getJoinedOn()));
        }
    }
}
