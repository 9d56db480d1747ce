package com.innstay.booking.dto.response;

import java.time.LocalDateTime;

/**
 * A booking together with a freshly issued guest access token. The token is
 * never returned again.
 */
public record BookingAccessResponse(
        BookingResponse booking,
        String accessToken,
        LocalDateTime accessExpiresAt
) {
}
