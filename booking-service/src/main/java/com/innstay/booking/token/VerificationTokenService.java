package com.innstay.booking.token;

import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.domain.VerificationToken;
import com.innstay.booking.repository.VerificationTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;

/**
 * Issues and validates opaque, time-limited guest tokens bound to one booking.
 * Tokens are 32 random bytes, base64url-encoded; only their keyed hash is
 * persisted. A token is valid up to and including its expiry instant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationTokenService {

    private static final int TOKEN_BYTES = 32;

    private final VerificationTokenRepository verificationTokenRepository;
    private final TokenHasher tokenHasher;
    private final BookingProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Transactional
    public IssuedToken issue(Long bookingId) {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        LocalDateTime issuedAt = LocalDateTime.now(clock);
        LocalDateTime expiresAt = issuedAt.plus(properties.getToken().getLifetime());
        verificationTokenRepository.save(
                new VerificationToken(bookingId, tokenHasher.hash(token), issuedAt, expiresAt));

        log.info("Verification token issued: bookingId={}, expiresAt={}", bookingId, expiresAt);
        return new IssuedToken(token, expiresAt);
    }

    @Transactional(readOnly = true)
    public TokenValidation validate(String token) {
        return validate(token, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public TokenValidation validate(String token, LocalDateTime now) {
        if (token == null || token.isBlank()) {
            return TokenValidation.invalid();
        }
        return verificationTokenRepository.findByTokenHash(tokenHasher.hash(token))
                .map(stored -> stored.isExpiredAt(now)
                        ? TokenValidation.expired(stored.getBookingId())
                        : TokenValidation.valid(stored.getBookingId()))
                .orElseGet(TokenValidation::invalid);
    }

    /**
     * Validates a token for a specific booking. A token bound to a different
     * booking is reported as plainly invalid, never as expired.
     */
    @Transactional(readOnly = true)
    public TokenValidation validateFor(String token, Long bookingId, LocalDateTime now) {
        TokenValidation result = validate(token, now);
        if (result.bookingId() != null && !result.bookingId().equals(bookingId)) {
            log.warn("Token presented for another booking: bookingId={}", bookingId);
            return TokenValidation.invalid();
        }
        return result;
    }

    @Transactional
    public int revokeForBooking(Long bookingId) {
        int revoked = verificationTokenRepository.deleteByBookingId(bookingId);
        log.info("Verification tokens revoked: bookingId={}, count={}", bookingId, revoked);
        return revoked;
    }

    @Transactional
    public int purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getToken().getRetention());
        return verificationTokenRepository.deleteExpiredBefore(cutoff);
    }
}
