package com.innstay.booking.security;

import com.innstay.booking.domain.Booking;
import com.innstay.booking.token.TokenValidation;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Decides whether a caller may read or act on a booking. Checked in order:
 * owner (matching user id or email), staff, then a verification token bound to
 * this booking. Denials use one generic message so callers cannot discover which
 * bookings exist.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingAccessGuard {

    private final VerificationTokenService verificationTokenService;
    private final Clock clock;

    public AccessGrant authorize(Booking booking, ActorContext actor, String token) {
        if (actor.isSystem()) {
            return AccessGrant.SYSTEM;
        }
        if (isOwner(booking, actor)) {
            return AccessGrant.OWNER;
        }
        if (actor.isStaff()) {
            return AccessGrant.STAFF;
        }

        TokenValidation validation =
                verificationTokenService.validateFor(token, booking.getId(), LocalDateTime.now(clock));
        if (validation.valid()) {
            return AccessGrant.TOKEN;
        }
        if (validation.expired()) {
            log.info("Expired verification token used: bookingId={}", booking.getId());
            throw new BusinessException(ErrorCode.TOKEN_EXPIRED);
        }

        log.warn("Booking access denied: bookingId={}, userId={}, ip={}",
                booking.getId(), actor.userId(), actor.clientIp());
        throw new BusinessException(ErrorCode.ACCESS_DENIED);
    }

    /**
     * Staff learn that a booking does not exist; everyone else gets the same
     * answer as for a booking they may not see.
     */
    public BusinessException notFound(ActorContext actor, Long bookingId) {
        if (actor.isStaff() || actor.isSystem()) {
            return new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
        }
        return new BusinessException(ErrorCode.ACCESS_DENIED);
    }

    private boolean isOwner(Booking booking, ActorContext actor) {
        if (actor.userId() != null && actor.userId().equals(booking.getUserId())) {
            return true;
        }
        return actor.isAuthenticated()
                && actor.email() != null
                && actor.email().equalsIgnoreCase(booking.getGuestEmail());
    }
}
