package com.innstay.booking.jooq;

import java.time.LocalDateTime;

/**
 * Position of a booking in the sweep order. Also serves as the keyset cursor
 * for the next page.
 */
public record ExpirationCandidate(Long id, LocalDateTime createdAt) {
}
