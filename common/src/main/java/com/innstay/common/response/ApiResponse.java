package com.innstay.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.innstay.common.exception.BusinessException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope for every JSON response: {@code data} on success, {@code error}
 * otherwise. Never both.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final ErrorResponse error;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> ok() {
        return new ApiResponse<>(true, null, null);
    }

    public static ApiResponse<Void> error(ErrorCode errorCode) {
        return new ApiResponse<>(false, null, ErrorResponse.of(errorCode));
    }

    public static ApiResponse<Void> error(ErrorCode errorCode, String message) {
        return new ApiResponse<>(false, null, ErrorResponse.of(errorCode, message));
    }

    public static ApiResponse<Void> error(BusinessException e) {
        return new ApiResponse<>(false, null,
                ErrorResponse.of(e.getErrorCode(), e.getMessage(), e.getDetails()));
    }
}
