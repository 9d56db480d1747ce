package com.innstay.booking.token;

import java.time.LocalDateTime;

/**
 * The plaintext token, returned exactly once at issue time.
 */
public record IssuedToken(String token, LocalDateTime expiresAt) {
}
