package com.innstay.common.exception;

import com.innstay.common.response.ErrorCode;
import lombok.Getter;

import java.util.Map;

/**
 * Thrown when a caller exhausts its request quota. Carries the number of
 * seconds until the current window resets.
 */
@Getter
public class RateLimitExceededException extends BusinessException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(long retryAfterSeconds) {
        super(ErrorCode.RATE_LIMITED,
                "Too many attempts. Please try again in " + retryAfterSeconds + " seconds.");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("retryAfterSeconds", retryAfterSeconds);
    }
}
