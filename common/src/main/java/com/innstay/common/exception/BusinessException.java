package com.innstay.common.exception;

import com.innstay.common.response.ErrorCode;
import lombok.Getter;

import java.util.Map;

/**
 * A failure the client can act on. The message is shown to the caller, so it
 * must not leak whether a booking exists to someone without access.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Structured context added to the error body. Empty unless a subclass has
     * something the client needs beyond the message.
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
