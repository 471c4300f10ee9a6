package com.jdc.ledger_service.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * 가구 단위로 한도를 관리하는 사용량 지표.
 * key 는 에러 코드(QUOTA_EXCEEDED_{key})와 API 응답에 그대로 노출된다.
 */
@Getter
@RequiredArgsConstructor
public enum UsageMetric {

    ACTIVE_CHORES("active_chores"),
    CHORE_PHOTOS("chore_photos"),
    ACTIVE_MEMBERS("active_members"),
    ACTIVE_EXPENSES("active_expenses"),
    ITEM_PHOTOS("item_photos");

    @JsonValue
    private final String key;

    public static Optional<UsageMetric> fromKey(String key) {
        return Arrays.stream(values())
                .filter(m -> m.key.equals(key))
                .findFirst();
    }
}
