package com.innstay.booking.lifecycle;

import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.audit.AuditSnapshot;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * The only writer of booking status and payment status.
 * <p>
 * The caller must hold the booking's row lock inside a transaction. The target
 * state is computed and validated before anything is mutated; a rejected
 * transition leaves the booking untouched. Every applied change is audited and
 * announced through the outbox in the same transaction. Applying a transition
 * that changes nothing is a no-op and produces neither. Entering CANCELLED
 * revokes the booking's guest verification links.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingStateMachine {

    static final String ENTITY_TYPE = "Booking";

    private static final Set<BookingStatus> OPEN = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final BookingExpirationPolicy expirationPolicy;
    private final AuditRecorder auditRecorder;
    private final BookingEventProducer bookingEventProducer;
    private final VerificationTokenService verificationTokenService;

    public TransitionResult transition(Booking booking, LifecycleEvent event) {
        LifecycleAction action = event.action();
        if (!action.allowedFor(event.actor().role())) {
            log.warn("Lifecycle action not permitted: bookingId={}, action={}, role={}",
                    booking.getId(), action, event.actor().role());
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    action + " is not permitted for role " + event.actor().role());
        }

        Target target = resolve(booking, event);

        BookingStatus previousStatus = booking.getStatus();
        BookingPaymentStatus previousPaymentStatus = booking.getPaymentStatus();
        AuditSnapshot before = BookingSnapshots.stateOf(booking);

        booking.applyTransition(target.status(), target.paymentStatus(), target.amountPaid());
        if (action == LifecycleAction.REFUND) {
            booking.refundSettledPayments();
        }

        AuditSnapshot after = BookingSnapshots.stateOf(booking);
        boolean changed = auditRecorder.recordChange(ENTITY_TYPE, String.valueOf(booking.getId()),
                event.actor().userId(), before, after).isPresent();

        if (changed) {
            if (booking.getStatus() == BookingStatus.CANCELLED && previousStatus != BookingStatus.CANCELLED) {
                verificationTokenService.revokeForBooking(booking.getId());
            }
            bookingEventProducer.publishStatusChanged(booking, previousStatus, previousPaymentStatus, action.name());
            log.info("Booking transitioned: bookingId={}, action={}, {}/{} -> {}/{}",
                    booking.getId(), action, previousStatus, previousPaymentStatus,
                    booking.getStatus(), booking.getPaymentStatus());
        }
        return new TransitionResult(previousStatus, previousPaymentStatus,
                booking.getStatus(), booking.getPaymentStatus(), changed);
    }

    private Target resolve(Booking booking, LifecycleEvent event) {
        return switch (event.action()) {
            case SETTLE_PAYMENT -> settle(booking);
            case RECORD_PAYMENT_FAILURE -> recordFailure(booking);
            case CONFIRM -> confirm(booking);
            case CANCEL -> cancel(booking);
            case EXPIRE -> expire(booking, event);
            case COMPLETE -> complete(booking);
            case REFUND -> refund(booking);
        };
    }

    private Target settle(Booking booking) {
        requireOpen(booking, LifecycleAction.SETTLE_PAYMENT);
        BigDecimal total = booking.getTotalAmount();
        BigDecimal paid = booking.settledTotal().min(total);
        if (paid.signum() == 0) {
            throw invalid(booking, LifecycleAction.SETTLE_PAYMENT, "no settled payment");
        }
        if (paid.compareTo(total) >= 0) {
            return new Target(BookingStatus.CONFIRMED, BookingPaymentStatus.PAID, total);
        }
        return new Target(booking.getStatus(), BookingPaymentStatus.PARTIALLY_PAID, paid);
    }

    private Target recordFailure(Booking booking) {
        requireOpen(booking, LifecycleAction.RECORD_PAYMENT_FAILURE);
        if (booking.getStatus() == BookingStatus.PENDING && !booking.hasPaidAmount()) {
            return new Target(BookingStatus.PENDING, BookingPaymentStatus.FAILED, BigDecimal.ZERO);
        }
        // Earlier settlements still stand
        return unchanged(booking);
    }

    private Target confirm(Booking booking) {
        BookingPaymentStatus paymentStatus = booking.getPaymentStatus();
        if (booking.getStatus() != BookingStatus.PENDING
                || (paymentStatus != BookingPaymentStatus.UNPAID
                && paymentStatus != BookingPaymentStatus.PARTIALLY_PAID)) {
            throw invalid(booking, LifecycleAction.CONFIRM, "only unpaid or partially paid pending bookings");
        }
        return new Target(BookingStatus.CONFIRMED, paymentStatus, booking.getAmountPaid());
    }

    private Target cancel(Booking booking) {
        requireOpen(booking, LifecycleAction.CANCEL);
        if (booking.hasPaidAmount()) {
            throw invalid(booking, LifecycleAction.CANCEL, "settled payments require a refund");
        }
        return new Target(BookingStatus.CANCELLED, booking.getPaymentStatus(), BigDecimal.ZERO);
    }

    private Target expire(Booking booking, LifecycleEvent event) {
        if (!expirationPolicy.isEligible(booking, event.occurredAt())) {
            throw invalid(booking, LifecycleAction.EXPIRE, "not eligible for expiration");
        }
        return new Target(BookingStatus.CANCELLED, BookingPaymentStatus.EXPIRED, BigDecimal.ZERO);
    }

    private Target complete(Booking booking) {
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            throw invalid(booking, LifecycleAction.COMPLETE, "only confirmed bookings");
        }
        return new Target(BookingStatus.COMPLETED, booking.getPaymentStatus(), booking.getAmountPaid());
    }

    private Target refund(Booking booking) {
        requireOpen(booking, LifecycleAction.REFUND);
        if (!booking.hasPaidAmount()) {
            throw invalid(booking, LifecycleAction.REFUND, "nothing has been paid");
        }
        return new Target(BookingStatus.CANCELLED, BookingPaymentStatus.REFUNDED, BigDecimal.ZERO);
    }

    private void requireOpen(Booking booking, LifecycleAction action) {
        if (!OPEN.contains(booking.getStatus())) {
            throw invalid(booking, action, "booking is " + booking.getStatus());
        }
    }

    private static Target unchanged(Booking booking) {
        return new Target(booking.getStatus(), booking.getPaymentStatus(), booking.getAmountPaid());
    }

    private static InvalidTransitionException invalid(Booking booking, LifecycleAction action, String detail) {
        return new InvalidTransitionException(action, booking.getStatus(), booking.getPaymentStatus(), detail);
    }

    private record Target(BookingStatus status, BookingPaymentStatus paymentStatus, BigDecimal amountPaid) {
    }
}
