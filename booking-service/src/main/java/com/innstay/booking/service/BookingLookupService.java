package com.innstay.booking.service;

import com.innstay.booking.domain.Booking;
import com.innstay.booking.dto.request.LookupRequest;
import com.innstay.booking.dto.response.BookingAccessResponse;
import com.innstay.booking.dto.response.BookingResponse;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.ratelimit.RateLimitPolicy;
import com.innstay.booking.ratelimit.RequestRateLimiter;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.token.IssuedToken;
import com.innstay.booking.token.TokenValidation;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Guest access without an account: manual lookup by reference and email,
 * access through an emailed link, and link re-issue. Every credential failure
 * returns the same message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingLookupService {

    private final BookingRepository bookingRepository;
    private final RequestRateLimiter rateLimiter;
    private final VerificationTokenService verificationTokenService;
    private final BookingEventProducer bookingEventProducer;

    @Transactional
    public BookingAccessResponse lookup(LookupRequest request, ActorContext actor) {
        rateLimiter.checkOrThrow(RateLimitPolicy.LOOKUP, actor.clientIp());

        Booking booking = findByCredentials(request).orElseThrow(() -> {
            log.info("Booking lookup failed: ip={}", actor.clientIp());
            return new BusinessException(ErrorCode.BOOKING_NOT_FOUND);
        });
        IssuedToken token = verificationTokenService.issue(booking.getId());
        return new BookingAccessResponse(BookingResponse.from(booking), token.token(), token.expiresAt());
    }

    @Transactional(readOnly = true)
    public BookingResponse accessByToken(String token) {
        TokenValidation validation = verificationTokenService.validate(token);
        if (validation.expired()) {
            throw new BusinessException(ErrorCode.TOKEN_EXPIRED,
                    "This link has expired. Please use the manual lookup form.");
        }
        if (!validation.valid()) {
            throw new BusinessException(ErrorCode.INVALID_TOKEN,
                    "Invalid or expired link. Please use the manual lookup form.");
        }
        return bookingRepository.findWithItemsById(validation.bookingId())
                .map(BookingResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_TOKEN));
    }

    /**
     * Rotates the guest link: earlier tokens stop working and a new one is
     * handed to the notification service. Unknown credentials are accepted
     * silently.
     */
    @Transactional
    public void requestAccessLink(LookupRequest request, ActorContext actor) {
        rateLimiter.checkOrThrow(RateLimitPolicy.LOOKUP, actor.clientIp());

        Optional<Booking> found = findByCredentials(request);
        if (found.isEmpty()) {
            log.info("Access link requested for unknown booking: ip={}", actor.clientIp());
            return;
        }
        Booking booking = found.get();
        verificationTokenService.revokeForBooking(booking.getId());
        IssuedToken token = verificationTokenService.issue(booking.getId());
        bookingEventProducer.publishAccessRequested(booking, token.token(), token.expiresAt());
    }

    private Optional<Booking> findByCredentials(LookupRequest request) {
        String email = request.email().trim();
        return bookingRepository.findByShortRef(ShortRefGenerator.normalize(request.shortRef()))
                .filter(booking -> booking.getGuestEmail().equalsIgnoreCase(email));
    }
}
