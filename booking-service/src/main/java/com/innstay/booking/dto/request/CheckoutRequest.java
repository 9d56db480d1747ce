package com.innstay.booking.dto.request;

import jakarta.validation.constraints.NotNull;

/**
 * {@code token} is required for guests without an account and ignored for
 * owners and staff.
 */
public record CheckoutRequest(
        @NotNull Long bookingId,
        String token
) {
}
