package com.innstay.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    UNAUTHORIZED(401, "C004", "Unauthorized"),
    FORBIDDEN(403, "C005", "Forbidden"),
    RATE_LIMITED(429, "C006", "Too many requests. Please try again later."),

    // Access
    ACCESS_DENIED(403, "A001", "Unable to process request. Please try again."),
    INVALID_TOKEN(401, "A002", "Invalid or unknown verification link"),
    TOKEN_EXPIRED(410, "A003", "Your session has expired. Please look up your booking again."),

    // Booking
    BOOKING_NOT_FOUND(404, "B001", "Booking not found. Please check your reference number and email."),
    INVALID_TRANSITION(409, "B002", "Booking cannot be changed in its current state"),
    LOCK_ACQUISITION_FAILED(409, "B003", "Booking is being updated. Please try again."),
    ROOM_RATE_UNAVAILABLE(400, "B004", "Room rate is not available"),

    // Payment
    PRICE_MISMATCH(409, "PRICE_MISMATCH", "Price has changed since booking was created. Please refresh and try again."),
    ALREADY_PAID(400, "P001", "Booking is already paid"),
    PAYMENT_GATEWAY_ERROR(503, "P002", "Payment service is temporarily unavailable. Please try again."),
    INVALID_SIGNATURE(401, "P003", "Invalid webhook signature"),

    // Audit
    INVALID_AUDIT_ENTRY(400, "AU01", "Invalid audit entry");

    private final int status;
    private final String code;
    private final String message;
}
