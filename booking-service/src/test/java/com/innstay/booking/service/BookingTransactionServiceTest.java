package com.innstay.booking.service;

import com.innstay.booking.TestFixtures;
import com.innstay.booking.audit.AuditAction;
import com.innstay.booking.audit.AuditContext;
import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import com.innstay.booking.domain.LocalRoomRate;
import com.innstay.booking.dto.request.CreateBookingRequest;
import com.innstay.booking.dto.response.BookingAccessResponse;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.lifecycle.BookingExpirationPolicy;
import com.innstay.booking.lifecycle.BookingStateMachine;
import com.innstay.booking.lifecycle.LifecycleAction;
import com.innstay.booking.lifecycle.LifecycleEvent;
import com.innstay.booking.pricing.BookingPriceCalculator;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.repository.LocalRoomRateRepository;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.security.ActorRole;
import com.innstay.booking.security.BookingAccessGuard;
import com.innstay.booking.token.IssuedToken;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingTransactionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 2, 1, 12, 0);
    private static final ActorContext OWNER = new ActorContext(100L, TestFixtures.GUEST_EMAIL, ActorRole.GUEST, "ip");

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private LocalRoomRateRepository localRoomRateRepository;
    @Mock
    private BookingStateMachine stateMachine;
    @Mock
    private BookingAccessGuard accessGuard;
    @Mock
    private VerificationTokenService verificationTokenService;
    @Mock
    private AuditRecorder auditRecorder;
    @Mock
    private BookingEventProducer bookingEventProducer;
    @Mock
    private ShortRefGenerator shortRefGenerator;

    private BookingTransactionService transactionService;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        transactionService = new BookingTransactionService(bookingRepository, localRoomRateRepository,
                new BookingPriceCalculator(properties), stateMachine, new BookingExpirationPolicy(properties),
                accessGuard, verificationTokenService, auditRecorder, bookingEventProducer, shortRefGenerator,
                properties);
    }

    @Test
    void create_activeRate_pricesStoresAuditsAndIssuesToken() {
        given(localRoomRateRepository.findById(10L)).willReturn(Optional.of(rate("PHP", true)));
        given(shortRefGenerator.generate()).willReturn("IS-7K2QMP");
        given(bookingRepository.save(any(Booking.class))).willAnswer(invocation -> {
            Booking booking = invocation.getArgument(0);
            TestFixtures.setEntityId(booking, 1L);
            return booking;
        });
        given(verificationTokenService.issue(1L)).willReturn(new IssuedToken("plain", NOW.plusHours(24)));

        BookingAccessResponse response = transactionService.create(request(10L), OWNER);

        assertThat(response.booking().shortRef()).isEqualTo("IS-7K2QMP");
        assertThat(response.booking().status()).isEqualTo(BookingStatus.PENDING);
        assertThat(response.booking().paymentStatus()).isEqualTo(BookingPaymentStatus.UNPAID);
        assertThat(response.booking().subtotalAmount()).isEqualByComparingTo("2000.00");
        assertThat(response.booking().totalAmount()).isEqualByComparingTo("2440.00");
        assertThat(response.booking().amountDue()).isEqualByComparingTo("2440.00");
        assertThat(response.accessToken()).isEqualTo("plain");

        ArgumentCaptor<AuditContext> captor = ArgumentCaptor.forClass(AuditContext.class);
        verify(auditRecorder).record(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.CREATE);
        assertThat(captor.getValue().entityId()).isEqualTo("1");
        assertThat(captor.getValue().actorId()).isEqualTo(100L);
        verify(bookingEventProducer).publishCreated(any(Booking.class));
    }

    @Test
    void create_inactiveRate_roomRateUnavailable() {
        given(localRoomRateRepository.findById(10L)).willReturn(Optional.of(rate("PHP", false)));

        assertThatThrownBy(() -> transactionService.create(request(10L), OWNER))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ROOM_RATE_UNAVAILABLE);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void create_foreignCurrencyRate_rejected() {
        given(localRoomRateRepository.findById(10L)).willReturn(Optional.of(rate("USD", true)));

        assertThatThrownBy(() -> transactionService.create(request(10L), OWNER))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("USD");
    }

    @Test
    void create_checkOutNotAfterCheckIn_invalidInput() {
        CreateBookingRequest request = new CreateBookingRequest("Juan", TestFixtures.GUEST_EMAIL, null,
                List.of(new CreateBookingRequest.StayRequest(10L, TestFixtures.CHECK_IN, TestFixtures.CHECK_IN)));

        assertThatThrownBy(() -> transactionService.create(request, OWNER))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
        verifyNoInteractions(localRoomRateRepository);
    }

    @Test
    void transition_guestCaller_authorizedBeforeStateMachine() {
        Booking booking = TestFixtures.createBooking(1L, NOW);
        LifecycleEvent event = LifecycleEvent.of(LifecycleAction.CANCEL, OWNER, NOW);
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        transactionService.transition(1L, event, null);

        InOrder inOrder = inOrder(accessGuard, stateMachine);
        inOrder.verify(accessGuard).authorize(booking, OWNER, null);
        inOrder.verify(stateMachine).transition(booking, event);
    }

    @Test
    void transition_systemCaller_skipsGuard() {
        Booking booking = TestFixtures.createBooking(1L, NOW);
        LifecycleEvent event = LifecycleEvent.system(LifecycleAction.EXPIRE, NOW);
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        transactionService.transition(1L, event, null);

        verifyNoInteractions(accessGuard);
        verify(stateMachine).transition(booking, event);
    }

    @Test
    void transition_missingBooking_guardDecidesError() {
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.empty());
        given(accessGuard.notFound(OWNER, 1L)).willReturn(new BusinessException(ErrorCode.ACCESS_DENIED));

        assertThatThrownBy(() -> transactionService.transition(1L,
                LifecycleEvent.of(LifecycleAction.CANCEL, OWNER, NOW), null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ACCESS_DENIED);
        verifyNoInteractions(stateMachine);
    }

    @Test
    void expireIfEligible_paidMeanwhile_notExpired() {
        Booking booking = TestFixtures.createBooking(1L, NOW.minusHours(2));
        booking.applyTransition(BookingStatus.CONFIRMED, BookingPaymentStatus.PAID, new BigDecimal("2440.00"));
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        assertThat(transactionService.expireIfEligible(1L, NOW)).isFalse();
        verifyNoInteractions(stateMachine);
    }

    @Test
    void expireIfEligible_staleUnpaid_expired() {
        Booking booking = TestFixtures.createBooking(1L, NOW.minusHours(2));
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        assertThat(transactionService.expireIfEligible(1L, NOW)).isTrue();
        verify(stateMachine).transition(booking, LifecycleEvent.system(LifecycleAction.EXPIRE, NOW));
    }

    private static CreateBookingRequest request(Long roomId) {
        return new CreateBookingRequest(" Juan Dela Cruz ", TestFixtures.GUEST_EMAIL, "+639171234567",
                List.of(new CreateBookingRequest.StayRequest(roomId, TestFixtures.CHECK_IN, TestFixtures.CHECK_OUT)));
    }

    private static LocalRoomRate rate(String currency, boolean active) {
        return new LocalRoomRate(10L, "Deluxe King", new BigDecimal("1000.00"), currency, active, NOW);
    }
}
