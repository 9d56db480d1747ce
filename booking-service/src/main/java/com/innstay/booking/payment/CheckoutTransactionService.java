package com.innstay.booking.payment;

import com.innstay.booking.audit.AuditContext;
import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.config.PaymentGatewayProperties;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingItem;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.Payment;
import com.innstay.booking.domain.PaymentStatus;
import com.innstay.booking.dto.response.CheckoutResponse;
import com.innstay.booking.pricing.PriceMismatchException;
import com.innstay.booking.pricing.PriceVerificationResult;
import com.innstay.booking.pricing.PriceVerificationService;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.repository.PaymentRepository;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.security.BookingAccessGuard;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Transactional halves of checkout. The provider call happens between them,
 * outside any database transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckoutTransactionService {

    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final BookingAccessGuard accessGuard;
    private final PriceVerificationService priceVerificationService;
    private final AuditRecorder auditRecorder;
    private final PaymentGatewayProperties gatewayProperties;
    private final Clock clock;

    /**
     * Checks, in order: the booking exists, the caller may act on it, it is
     * not already paid, and its stored total still matches current rates.
     * Fails on the first violated condition.
     */
    @Transactional(readOnly = true)
    public CheckoutPlan prepare(Long bookingId, ActorContext actor, String token) {
        Booking booking = bookingRepository.findWithItemsById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCESS_DENIED));

        accessGuard.authorize(booking, actor, token);

        if (booking.getPaymentStatus() == BookingPaymentStatus.PAID) {
            throw new BusinessException(ErrorCode.ALREADY_PAID);
        }
        if (booking.getStatus().isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "Booking is " + booking.getStatus() + " and can no longer be paid");
        }

        PriceVerificationResult price = priceVerificationService.verify(booking);
        if (!price.valid()) {
            throw new PriceMismatchException(price);
        }

        LocalDateTime reuseAfter = LocalDateTime.now(clock).minus(gatewayProperties.getSessionReuseWindow());
        Optional<Payment> open = paymentRepository.findFirstByBookingIdAndStatusAndCreatedAtAfterOrderByCreatedAtDesc(
                bookingId, PaymentStatus.PENDING, reuseAfter);
        if (open.isPresent() && open.get().getAmount().compareTo(booking.getAmountDue()) == 0) {
            Payment payment = open.get();
            log.info("Reusing open checkout session: bookingId={}, paymentId={}", bookingId, payment.getId());
            return CheckoutPlan.reuse(new CheckoutResponse(payment.getCheckoutUrl(), payment.getExternalId(),
                    payment.getId(), payment.getAmount(), payment.getCurrency()));
        }

        String description = booking.getItems().stream()
                .map(item -> "Room " + item.getRoomId() + " x" + item.getNights())
                .collect(Collectors.joining(", "));
        return CheckoutPlan.create(new PaymentGatewayClient.CheckoutSessionRequest(
                booking.getId(), booking.getShortRef(), booking.getAmountDue(), booking.getCurrency(),
                description, booking.getGuestName(), booking.getGuestEmail()));
    }

    @Transactional
    public CheckoutResponse recordPendingPayment(Long bookingId, PaymentGatewayClient.CheckoutSessionRequest request,
                                                 PaymentGatewayClient.CheckoutSession session, String provider,
                                                 ActorContext actor) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ACCESS_DENIED));

        Payment payment = paymentRepository.save(
                booking.addPayment(request.amount(), provider, session.sessionId(), session.checkoutUrl()));
        auditRecorder.record(AuditContext.forCreate(PaymentSnapshots.ENTITY_TYPE, String.valueOf(payment.getId()),
                PaymentSnapshots.of(payment), actor.userId()));

        log.info("Payment pending: bookingId={}, paymentId={}, sessionId={}, amount={}",
                bookingId, payment.getId(), session.sessionId(), payment.getAmount());
        return new CheckoutResponse(session.checkoutUrl(), session.sessionId(),
                payment.getId(), payment.getAmount(), payment.getCurrency());
    }
}
