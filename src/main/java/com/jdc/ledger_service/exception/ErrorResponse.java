package com.jdc.ledger_service.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.Map;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String error;
    private final String message;
    private String errorId;
    private Boolean retryable;
    private Map<String, Object> details;

    public ErrorResponse(String code, String error, String message) {
        this.code = code;
        this.error = error;
        this.message = message;
    }

    public ErrorResponse(String code, String error, String message, String errorId) {
        this(code, error, message);
        this.errorId = errorId;
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.name(), errorCode.getMessage());
        if (errorCode.isRetryable()) response.retryable = true;
        return response;
    }

    public static ErrorResponse of(CustomException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), ex.getSymbol(), ex.getMessage());
        if (errorCode.isRetryable()) response.retryable = true;
        response.details = ex.getDetails();
        return response;
    }
}
