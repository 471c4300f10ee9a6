package com.jdc.ledger_service.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- Household (100) ---
    HOUSEHOLD_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "요청한 가구가 존재하지 않습니다."),
    TENANT_INACTIVE(HttpStatus.CONFLICT, "102", "비활성화된 가구입니다.", true),
    MEMBER_NOT_FOUND(HttpStatus.NOT_FOUND, "103", "가구 구성원이 아닙니다."),

    // --- Usage / Quota (200) ---
    QUOTA_EXCEEDED(HttpStatus.PAYMENT_REQUIRED, "201", "요금제 한도를 초과했습니다."),

    // --- Recurring plan (300) ---
    PLAN_NOT_FOUND(HttpStatus.NOT_FOUND, "301", "요청한 반복 지출이 존재하지 않습니다."),
    INVALID_RECURRENCE(HttpStatus.BAD_REQUEST, "302", "반복 주기가 유효하지 않습니다."),
    INVALID_SHARES(HttpStatus.BAD_REQUEST, "303", "분담 내역이 유효하지 않습니다."),
    INVALID_SHARES_SUM(HttpStatus.BAD_REQUEST, "304", "분담 금액의 합이 총액과 일치하지 않습니다."),
    PARTICIPANT_NOT_MEMBER(HttpStatus.BAD_REQUEST, "305", "참여자가 현재 가구 구성원이 아닙니다."),
    INVALID_START_DATE_RANGE(HttpStatus.BAD_REQUEST, "306", "시작일이 허용 범위를 벗어났습니다."),
    INVALID_CYCLE_DATE(HttpStatus.BAD_REQUEST, "307", "회차 날짜가 시작일보다 빠릅니다."),
    PLAN_NOT_OWNER(HttpStatus.FORBIDDEN, "308", "반복 지출의 소유자만 처리할 수 있습니다."),
    PLAN_NOT_ACTIVE(HttpStatus.CONFLICT, "309", "이미 종료된 반복 지출입니다.", true),

    // --- Expense (400) ---
    EXPENSE_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "요청한 지출이 존재하지 않습니다."),

    // --- Chore (500) ---
    CHORE_NOT_FOUND(HttpStatus.NOT_FOUND, "501", "요청한 집안일이 존재하지 않습니다."),
    CHORE_NOT_ASSIGNEE(HttpStatus.FORBIDDEN, "502", "담당자만 집안일을 완료할 수 있습니다."),
    CHORE_NOT_ACTIVE(HttpStatus.BAD_REQUEST, "503", "진행 중인 집안일이 아닙니다."),

    // --- Concurrency (800) ---
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "801", "다른 요청에 의해 데이터가 변경되었습니다.", true),
    STATE_CHANGED_RETRY(HttpStatus.CONFLICT, "802", "처리 중 상태가 변경되었습니다. 다시 시도해주세요.", true),
    LOCK_ACQUISITION_FAILED(HttpStatus.CONFLICT, "803", "잠시 후 다시 시도해주세요.", true),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류가 발생했습니다."),
    MISSING_HEADER(HttpStatus.BAD_REQUEST, "904", "필수 헤더가 누락되었습니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "905", "데이터 무결성 제약조건을 위반했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
    private final boolean retryable;

    ErrorCode(HttpStatus status, String code, String message) {
        this(status, code, message, false);
    }

    ErrorCode(HttpStatus status, String code, String message, boolean retryable) {
        this.status = status;
        this.code = code;
        this.message = message;
        this.retryable = retryable;
    }
}
