package com.jdc.ledger_service.service.household;

import com.jdc.ledger_service.domain.entity.household.Household;
import com.jdc.ledger_service.domain.repository.household.HouseholdRepository;
import com.jdc.ledger_service.exception.CustomException;
import com.jdc.ledger_service.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * 모든 변경 경로의 첫 번째 락. 순서: 가구 -> 플랜/지출/집안일 -> 사용량 -> 분담.
 * 같은 단계의 행이 여러 개면 id 오름차순으로 잠근다.
 * 스케줄러는 기다리지 않는 잠금이 필요해 DuePlanClaimDao 에서 가구를 잡는다.
 */
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class HouseholdLockService {

    private final HouseholdRepository householdRepository;

    public Household lockActive(Long householdId) {
        Household household = lock(householdId);
        if (!household.isActive()) {
            throw new CustomException(ErrorCode.TENANT_INACTIVE);
        }
        return household;
    }

    public Household lock(Long householdId) {
        return householdRepository.findByIdForUpdate(householdId)
                .orElseThrow(() -> new CustomException(ErrorCode.HOUSEHOLD_NOT_FOUND));
    }

    public List<Household> lockAllInOrder(Collection<Long> householdIds) {
        if (householdIds.isEmpty()) {
            return List.of();
        }
        return householdRepository.findAllByIdInForUpdate(householdIds);
    }
}
