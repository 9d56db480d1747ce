package com.innstay.booking.lifecycle;

import com.innstay.booking.TestFixtures;
import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import com.innstay.booking.domain.PaymentStatus;
import com.innstay.booking.domain.Payment;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.security.ActorRole;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingStateMachineTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 2, 1, 12, 0);

    @Mock
    private BookingEventProducer bookingEventProducer;
    @Mock
    private VerificationTokenService verificationTokenService;

    private AuditRecorder auditRecorder;

    private BookingStateMachine stateMachine;

    private final ActorContext staff = new ActorContext(1L, "staff@innstay.ph", ActorRole.STAFF, "10.0.0.1");
    private final ActorContext guest = new ActorContext(100L, TestFixtures.GUEST_EMAIL, ActorRole.GUEST, "10.0.0.2");

    @BeforeEach
    void setUp() {
        auditRecorder = TestFixtures.diffingAuditRecorder();
        stateMachine = new BookingStateMachine(new BookingExpirationPolicy(new BookingProperties()),
                auditRecorder, bookingEventProducer, verificationTokenService);
    }

    @Test
    void settlePayment_fullAmount_confirmsAndMarksPaid() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        TestFixtures.addPayment(booking, 1L, "cs_1", "2440.00").markPaid("pay_1", T0);

        TransitionResult result = stateMachine.transition(booking,
                LifecycleEvent.system(LifecycleAction.SETTLE_PAYMENT, T0));

        assertThat(result.changed()).isTrue();
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PAID);
        assertThat(booking.getAmountDue()).isEqualByComparingTo("0");
        verify(bookingEventProducer).publishStatusChanged(booking, BookingStatus.PENDING,
                BookingPaymentStatus.UNPAID, "SETTLE_PAYMENT");
    }

    @Test
    void settlePayment_partialAmount_staysPendingPartiallyPaid() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        TestFixtures.addPayment(booking, 1L, "cs_1", "1000.00").markPaid("pay_1", T0);

        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.SETTLE_PAYMENT, T0));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PARTIALLY_PAID);
        assertThat(booking.getAmountPaid()).isEqualByComparingTo("1000.00");
        assertThat(booking.getAmountDue()).isEqualByComparingTo("1440.00");
    }

    @Test
    void settlePayment_overpayment_capsAmountPaidAtTotal() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        TestFixtures.addPayment(booking, 1L, "cs_1", "3000.00").markPaid("pay_1", T0);

        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.SETTLE_PAYMENT, T0));

        assertThat(booking.getAmountPaid()).isEqualByComparingTo("2440.00");
        assertThat(booking.getAmountDue()).isEqualByComparingTo("0");
    }

    @Test
    void settlePayment_nothingSettled_throwsInvalidTransition() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.system(LifecycleAction.SETTLE_PAYMENT, T0)))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.UNPAID);
        verifyNoInteractions(bookingEventProducer);
    }

    @Test
    void settlePayment_byGuest_throwsForbidden() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.SETTLE_PAYMENT, guest, T0)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.FORBIDDEN);
    }

    @Test
    void recordPaymentFailure_unpaidPending_marksFailed() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.RECORD_PAYMENT_FAILURE, T0));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.FAILED);
    }

    @Test
    void recordPaymentFailure_partiallyPaid_keepsEarlierSettlement() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        booking.applyTransition(BookingStatus.PENDING, BookingPaymentStatus.PARTIALLY_PAID,
                new java.math.BigDecimal("1000.00"));

        TransitionResult result = stateMachine.transition(booking,
                LifecycleEvent.system(LifecycleAction.RECORD_PAYMENT_FAILURE, T0));

        assertThat(result.changed()).isFalse();
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PARTIALLY_PAID);
        verifyNoInteractions(bookingEventProducer);
    }

    @Test
    void confirm_byStaff_confirmsUnpaidBooking() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        stateMachine.transition(booking, LifecycleEvent.of(LifecycleAction.CONFIRM, staff, T0));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.UNPAID);
        verify(auditRecorder).recordChange(eq("Booking"), eq("1"), eq(1L), any(), any());
        verifyNoInteractions(verificationTokenService);
    }

    @Test
    void confirm_byGuest_throwsForbidden() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.CONFIRM, guest, T0)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("not permitted");
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    void cancel_unpaidBooking_cancels() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        stateMachine.transition(booking, LifecycleEvent.of(LifecycleAction.CANCEL, guest, T0));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.UNPAID);
        verify(verificationTokenService).revokeForBooking(1L);
    }

    @Test
    void cancel_paidBooking_requiresRefund() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        booking.applyTransition(BookingStatus.CONFIRMED, BookingPaymentStatus.PAID,
                new java.math.BigDecimal("2440.00"));

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.CANCEL, guest, T0)))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    void cancel_alreadyCancelled_throwsInvalidTransition() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        booking.applyTransition(BookingStatus.CANCELLED, BookingPaymentStatus.EXPIRED,
                java.math.BigDecimal.ZERO);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.CANCEL, staff, T0)))
                .isInstanceOf(InvalidTransitionException.class);
        verifyNoInteractions(verificationTokenService);
    }

    @Test
    void expire_staleUnpaidBooking_cancelsAsExpired() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.EXPIRE, T0.plusMinutes(31)));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.EXPIRED);
        verify(verificationTokenService).revokeForBooking(1L);
    }

    @Test
    void expire_freshBooking_throwsInvalidTransition() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.system(LifecycleAction.EXPIRE, T0.plusMinutes(29))))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    void complete_confirmedBooking_completes() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        booking.applyTransition(BookingStatus.CONFIRMED, BookingPaymentStatus.PAID,
                new java.math.BigDecimal("2440.00"));

        stateMachine.transition(booking, LifecycleEvent.of(LifecycleAction.COMPLETE, staff, T0));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PAID);
    }

    @Test
    void complete_pendingBooking_throwsInvalidTransition() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.COMPLETE, staff, T0)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void refund_paidBooking_cancelsAndRefundsPayments() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        Payment payment = TestFixtures.addPayment(booking, 1L, "cs_1", "2440.00");
        payment.markPaid("pay_1", T0);
        stateMachine.transition(booking, LifecycleEvent.system(LifecycleAction.SETTLE_PAYMENT, T0));

        stateMachine.transition(booking, LifecycleEvent.of(LifecycleAction.REFUND, staff, T0));

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.REFUNDED);
        assertThat(booking.getAmountPaid()).isEqualByComparingTo("0");
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        verify(verificationTokenService).revokeForBooking(1L);
    }

    @Test
    void refund_unpaidBooking_throwsInvalidTransition() {
        Booking booking = TestFixtures.createBooking(1L, T0);

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.REFUND, staff, T0)))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void refund_cancelledBooking_throwsInvalidTransition() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        stateMachine.transition(booking, LifecycleEvent.of(LifecycleAction.CANCEL, guest, T0));

        assertThatThrownBy(() -> stateMachine.transition(booking,
                LifecycleEvent.of(LifecycleAction.REFUND, staff, T0)))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        verify(verificationTokenService).revokeForBooking(1L);
    }
}
