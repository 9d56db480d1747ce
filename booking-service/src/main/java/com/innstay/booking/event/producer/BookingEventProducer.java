package com.innstay.booking.event.producer;

import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import com.innstay.booking.domain.Payment;
import com.innstay.booking.event.outbox.OutboxEventService;
import com.innstay.common.event.BookingEvent;
import com.innstay.common.event.PaymentEvent;
import com.innstay.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * State-change notification channel. Everything goes through the outbox in the
 * caller's transaction; nothing is sent to Kafka directly.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    static final String AGGREGATE_BOOKING = "Booking";

    private final OutboxEventService outboxEventService;

    public void publishCreated(Booking booking) {
        BookingEvent event = BookingEvent.created(booking.getId(), booking.getShortRef(),
                booking.getStatus().name(), booking.getPaymentStatus().name(), booking.getTotalAmount());
        outboxEventService.append(AGGREGATE_BOOKING, booking.getId(), Topics.BOOKING_CREATED, event);
    }

    public void publishStatusChanged(Booking booking, BookingStatus previousStatus,
                                     BookingPaymentStatus previousPaymentStatus, String trigger) {
        BookingEvent event = BookingEvent.statusChanged(booking.getId(), booking.getShortRef(),
                previousStatus.name(), previousPaymentStatus.name(),
                booking.getStatus().name(), booking.getPaymentStatus().name(),
                trigger, booking.getAmountDue());
        outboxEventService.append(AGGREGATE_BOOKING, booking.getId(), Topics.BOOKING_STATUS_CHANGED, event);
    }

    public void publishAccessRequested(Booking booking, String token, LocalDateTime expiresAt) {
        BookingEvent event = BookingEvent.accessRequested(booking.getId(), booking.getShortRef(),
                booking.getGuestEmail(), token, expiresAt);
        outboxEventService.append(AGGREGATE_BOOKING, booking.getId(), Topics.BOOKING_ACCESS_REQUESTED, event);
    }

    public void publishPaymentSettled(Booking booking, Payment payment) {
        PaymentEvent event = PaymentEvent.settled(payment.getId(), booking.getId(),
                payment.getExternalId(), payment.getAmount(), payment.getCurrency());
        outboxEventService.append(AGGREGATE_BOOKING, booking.getId(), Topics.PAYMENT_SETTLED, event);
    }

    public void publishPaymentFailed(Booking booking, Payment payment) {
        PaymentEvent event = PaymentEvent.failed(payment.getId(), booking.getId(),
                payment.getExternalId(), payment.getFailureReason());
        outboxEventService.append(AGGREGATE_BOOKING, booking.getId(), Topics.PAYMENT_FAILED, event);
    }

    public void publishRefundRequired(Booking booking, Payment payment, BigDecimal amount, String reason) {
        PaymentEvent event = PaymentEvent.refundRequired(payment.getId(), booking.getId(),
                payment.getExternalId(), amount, payment.getCurrency(), reason);
        outboxEventService.append(AGGREGATE_BOOKING, booking.getId(), Topics.PAYMENT_REFUND_REQUIRED, event);
        log.warn("Refund required: bookingId={}, paymentId={}, amount={}, reason={}",
                booking.getId(), payment.getId(), amount, reason);
    }
}
