package com.jdc.ledger_service.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class CustomException extends RuntimeException {

    private final ErrorCode errorCode;

    public CustomException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public CustomException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /** 응답의 error 필드에 내려가는 기호 이름. */
    public String getSymbol() {
        return errorCode.name();
    }

    public Map<String, Object> getDetails() {
        return null;
    }
}
