package com.innstay.booking.service;

import com.innstay.booking.audit.AuditContext;
import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.LocalRoomRate;
import com.innstay.booking.dto.request.CreateBookingRequest;
import com.innstay.booking.dto.response.BookingAccessResponse;
import com.innstay.booking.dto.response.BookingResponse;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.lifecycle.BookingExpirationPolicy;
import com.innstay.booking.lifecycle.BookingSnapshots;
import com.innstay.booking.lifecycle.BookingStateMachine;
import com.innstay.booking.lifecycle.LifecycleAction;
import com.innstay.booking.lifecycle.LifecycleEvent;
import com.innstay.booking.pricing.BookingPriceCalculator;
import com.innstay.booking.pricing.PriceBreakdown;
import com.innstay.booking.pricing.PriceLine;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.repository.LocalRoomRateRepository;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.security.BookingAccessGuard;
import com.innstay.booking.token.IssuedToken;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Separated from BookingCommandService to ensure @Transactional works
 * (avoids Spring AOP self-invocation bypass). Every transition loads the
 * booking with a row lock first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionService {

    static final String ENTITY_TYPE = "Booking";

    private final BookingRepository bookingRepository;
    private final LocalRoomRateRepository localRoomRateRepository;
    private final BookingPriceCalculator priceCalculator;
    private final BookingStateMachine stateMachine;
    private final BookingExpirationPolicy expirationPolicy;
    private final BookingAccessGuard accessGuard;
    private final VerificationTokenService verificationTokenService;
    private final AuditRecorder auditRecorder;
    private final BookingEventProducer bookingEventProducer;
    private final ShortRefGenerator shortRefGenerator;
    private final BookingProperties properties;

    @Transactional
    public BookingAccessResponse create(CreateBookingRequest request, ActorContext actor) {
        String currency = properties.getPricing().getCurrency();
        List<PriceLine> lines = new ArrayList<>();
        for (CreateBookingRequest.StayRequest stay : request.items()) {
            if (!stay.checkOut().isAfter(stay.checkIn())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "checkOut must be after checkIn for room " + stay.roomId());
            }
            LocalRoomRate rate = localRoomRateRepository.findById(stay.roomId())
                    .filter(LocalRoomRate::isActive)
                    .orElseThrow(() -> new BusinessException(ErrorCode.ROOM_RATE_UNAVAILABLE,
                            "Room is not available for booking: " + stay.roomId()));
            if (!currency.equals(rate.getCurrency())) {
                throw new BusinessException(ErrorCode.ROOM_RATE_UNAVAILABLE,
                        "Room " + stay.roomId() + " is priced in " + rate.getCurrency());
            }
            lines.add(new PriceLine(stay.roomId(), rate.getNightlyRate(), stay.checkIn(), stay.checkOut()));
        }

        PriceBreakdown price = priceCalculator.calculate(lines);
        Booking booking = Booking.builder()
                .shortRef(shortRefGenerator.generate())
                .userId(actor.userId())
                .guestName(request.guestName().trim())
                .guestEmail(request.guestEmail().trim())
                .guestPhone(request.guestPhone())
                .currency(currency)
                .build();
        lines.forEach(line -> booking.addItem(
                line.roomId(), line.checkIn(), line.checkOut(), line.nights(), line.nightlyRate()));
        booking.applyCharges(price.subtotal(), price.tax(), price.serviceCharge(), price.total());

        Booking saved = bookingRepository.save(booking);
        auditRecorder.record(AuditContext.forCreate(ENTITY_TYPE, String.valueOf(saved.getId()),
                BookingSnapshots.creationOf(saved), actor.userId()));
        IssuedToken token = verificationTokenService.issue(saved.getId());
        bookingEventProducer.publishCreated(saved);

        log.info("Booking created: bookingId={}, shortRef={}, total={} {}",
                saved.getId(), saved.getShortRef(), saved.getTotalAmount(), currency);
        return new BookingAccessResponse(BookingResponse.from(saved), token.token(), token.expiresAt());
    }

    /**
     * Applies a lifecycle event on behalf of a caller. Non-system callers must
     * pass the access guard first.
     */
    @Transactional
    public BookingResponse transition(Long bookingId, LifecycleEvent event, String token) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> accessGuard.notFound(event.actor(), bookingId));
        if (!event.actor().isSystem()) {
            accessGuard.authorize(booking, event.actor(), token);
        }
        stateMachine.transition(booking, event);
        return BookingResponse.from(booking);
    }

    /**
     * Re-checks eligibility under the row lock, so a payment that lands
     * between the sweep's scan and this call wins.
     */
    @Transactional
    public boolean expireIfEligible(Long bookingId, LocalDateTime now) {
        Optional<Booking> found = bookingRepository.findByIdForUpdate(bookingId);
        if (found.isEmpty()) {
            return false;
        }
        Booking booking = found.get();
        if (!expirationPolicy.isEligible(booking, now)) {
            log.debug("Booking no longer eligible for expiration: bookingId={}, status={}/{}",
                    bookingId, booking.getStatus(), booking.getPaymentStatus());
            return false;
        }
        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.EXPIRE, now));
        return true;
    }
}
