package com.innstay.booking.payment;

import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.audit.AuditSnapshot;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.Payment;
import com.innstay.booking.event.IdempotencyService;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.lifecycle.BookingStateMachine;
import com.innstay.booking.lifecycle.LifecycleAction;
import com.innstay.booking.lifecycle.LifecycleEvent;
import com.innstay.booking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Separated from PaymentSettlementService to ensure @Transactional works
 * (avoids Spring AOP self-invocation bypass).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentSettlementTransactionService {

    static final String SOURCE = "payment-settlement";

    private final BookingRepository bookingRepository;
    private final BookingStateMachine stateMachine;
    private final AuditRecorder auditRecorder;
    private final BookingEventProducer bookingEventProducer;
    private final IdempotencyService idempotencyService;
    private final Clock clock;

    @Transactional
    public SettlementOutcome apply(Long bookingId, SettlementCommand command) {
        Optional<Booking> found = bookingRepository.findByIdForUpdate(bookingId);
        Optional<Payment> payment = found.flatMap(b -> b.findPayment(command.sessionId()));
        if (payment.isEmpty()) {
            log.warn("Settlement for unknown session: bookingId={}, sessionId={}", bookingId, command.sessionId());
            idempotencyService.markProcessed(command.eventId(), SOURCE);
            return SettlementOutcome.UNKNOWN_SESSION;
        }

        SettlementOutcome outcome = applyToPayment(found.get(), payment.get(), command);
        if (outcome != SettlementOutcome.STILL_PENDING) {
            idempotencyService.markProcessed(command.eventId(), SOURCE);
        }
        return outcome;
    }

    private SettlementOutcome applyToPayment(Booking booking, Payment payment, SettlementCommand command) {
        if (!payment.isPending()) {
            log.info("Payment already settled: paymentId={}, status={}, reported={}",
                    payment.getId(), payment.getStatus(), command.outcome());
            return SettlementOutcome.ALREADY_APPLIED;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        AuditSnapshot before = PaymentSnapshots.of(payment);
        return switch (command.outcome()) {
            case PENDING -> SettlementOutcome.STILL_PENDING;
            case PAID -> settlePaid(booking, payment, command, before, now);
            case FAILED -> {
                payment.markFailed(command.failureReason(), now);
                auditPayment(payment, before);
                bookingEventProducer.publishPaymentFailed(booking, payment);
                if (!booking.getStatus().isTerminal()) {
                    stateMachine.transition(booking,
                            LifecycleEvent.system(LifecycleAction.RECORD_PAYMENT_FAILURE, now));
                }
                yield SettlementOutcome.APPLIED;
            }
            case EXPIRED -> {
                payment.markExpired(now);
                auditPayment(payment, before);
                yield SettlementOutcome.APPLIED;
            }
        };
    }

    private SettlementOutcome settlePaid(Booking booking, Payment payment, SettlementCommand command,
                                         AuditSnapshot before, LocalDateTime now) {
        if (command.amount() != null && command.amount().compareTo(payment.getAmount()) != 0) {
            log.warn("Provider amount differs from payment: paymentId={}, expected={}, reported={}",
                    payment.getId(), payment.getAmount(), command.amount());
        }
        BigDecimal excessBefore = excess(booking);
        payment.markPaid(command.paymentReference(), now);
        auditPayment(payment, before);
        bookingEventProducer.publishPaymentSettled(booking, payment);

        if (booking.getStatus().isTerminal()) {
            bookingEventProducer.publishRefundRequired(booking, payment, payment.getAmount(),
                    "Payment received after booking was " + booking.getStatus());
            return SettlementOutcome.LATE_PAYMENT;
        }

        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.SETTLE_PAYMENT, now));
        BigDecimal newExcess = excess(booking).subtract(excessBefore);
        if (newExcess.signum() > 0) {
            bookingEventProducer.publishRefundRequired(booking, payment, newExcess,
                    "Payment exceeds booking total");
        }
        return SettlementOutcome.APPLIED;
    }

    private void auditPayment(Payment payment, AuditSnapshot before) {
        auditRecorder.recordChange(PaymentSnapshots.ENTITY_TYPE, String.valueOf(payment.getId()),
                null, before, PaymentSnapshots.of(payment));
    }

    private static BigDecimal excess(Booking booking) {
        return booking.settledTotal().subtract(booking.getTotalAmount()).max(BigDecimal.ZERO);
    }
}
