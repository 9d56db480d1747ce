package com.innstay.booking.expiration;

import com.innstay.booking.TestFixtures;
import com.innstay.booking.audit.AuditRecorder;
import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import com.innstay.booking.event.producer.BookingEventProducer;
import com.innstay.booking.jooq.BookingJooqRepository;
import com.innstay.booking.jooq.ExpirationCandidate;
import com.innstay.booking.lifecycle.BookingExpirationPolicy;
import com.innstay.booking.lifecycle.BookingStateMachine;
import com.innstay.booking.pricing.BookingPriceCalculator;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.repository.LocalRoomRateRepository;
import com.innstay.booking.security.BookingAccessGuard;
import com.innstay.booking.service.BookingMutationExecutor;
import com.innstay.booking.service.BookingTransactionService;
import com.innstay.booking.service.ShortRefGenerator;
import com.innstay.booking.token.VerificationTokenService;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingExpirationSweeperTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 2, 1, 12, 0);

    @Mock
    private BookingJooqRepository bookingJooqRepository;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingMutationExecutor mutationExecutor;
    @Mock
    private BookingEventProducer bookingEventProducer;
    @Mock
    private VerificationTokenService verificationTokenService;

    private AuditRecorder auditRecorder;
    private BookingProperties properties;
    private BookingExpirationSweeper sweeper;

    @BeforeEach
    void setUp() {
        auditRecorder = TestFixtures.diffingAuditRecorder();
        properties = new BookingProperties();
        BookingExpirationPolicy policy = new BookingExpirationPolicy(properties);
        BookingStateMachine stateMachine = new BookingStateMachine(policy, auditRecorder, bookingEventProducer,
                verificationTokenService);
        BookingTransactionService transactionService = new BookingTransactionService(
                bookingRepository, mock(LocalRoomRateRepository.class), mock(BookingPriceCalculator.class),
                stateMachine, policy, mock(BookingAccessGuard.class), verificationTokenService,
                auditRecorder, bookingEventProducer, mock(ShortRefGenerator.class), properties);
        sweeper = new BookingExpirationSweeper(bookingJooqRepository, policy, mutationExecutor,
                transactionService, properties, Clock.fixed(T0.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void sweep_bookingYoungerThanThreshold_staysPending() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        givenCandidates(candidate(1L, T0));
        givenMutationsRunInline(Set.of());
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        SweepResult result = sweeper.sweep(T0.plusMinutes(29));

        assertThat(result.expiredCount()).isZero();
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        verifyNoInteractions(auditRecorder, bookingEventProducer, verificationTokenService);
    }

    @Test
    void sweep_bookingOlderThanThreshold_cancelledWithOneAuditEntry() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        given(bookingJooqRepository.findExpirationCandidates(eq(T0.plusMinutes(1)), isNull(), anyInt()))
                .willReturn(List.of(candidate(1L, T0)));
        givenMutationsRunInline(Set.of());
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        SweepResult result = sweeper.sweep(T0.plusMinutes(31));

        assertThat(result.expiredIds()).containsExactly(1L);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.EXPIRED);
        verify(auditRecorder, times(1)).recordChange(eq("Booking"), eq("1"), any(), any(), any());
        verify(bookingEventProducer).publishStatusChanged(booking, BookingStatus.PENDING,
                BookingPaymentStatus.UNPAID, "EXPIRE");
        verify(verificationTokenService).revokeForBooking(1L);
    }

    @Test
    void sweep_partiallyPaidBooking_neverExpired() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        booking.applyTransition(BookingStatus.PENDING, BookingPaymentStatus.PARTIALLY_PAID, new BigDecimal("500.00"));
        givenCandidates(candidate(1L, T0));
        givenMutationsRunInline(Set.of());
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        SweepResult result = sweeper.sweep(T0.plusDays(2));

        assertThat(result.expiredCount()).isZero();
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.PARTIALLY_PAID);
    }

    @Test
    void sweep_oneBookingFails_othersStillExpire() {
        Booking second = TestFixtures.createBooking(2L, T0);
        givenCandidates(candidate(1L, T0), candidate(2L, T0));
        givenMutationsRunInline(Set.of(1L));
        given(bookingRepository.findByIdForUpdate(2L)).willReturn(Optional.of(second));

        SweepResult result = sweeper.sweep(T0.plusHours(1));

        assertThat(result.expiredIds()).containsExactly(2L);
        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(second.getStatus()).isEqualTo(BookingStatus.CANCELLED);
    }

    @Test
    void sweep_fullBatchOfFailures_pagesPastThemToNewerBookings() {
        properties.getExpiration().setBatchSize(2);
        ExpirationCandidate first = candidate(1L, T0);
        ExpirationCandidate second = candidate(2L, T0.plusMinutes(1));
        Booking third = TestFixtures.createBooking(3L, T0.plusMinutes(2));
        given(bookingJooqRepository.findExpirationCandidates(any(), isNull(), eq(2)))
                .willReturn(List.of(first, second));
        given(bookingJooqRepository.findExpirationCandidates(any(), eq(second), eq(2)))
                .willReturn(List.of(candidate(3L, T0.plusMinutes(2))));
        givenMutationsRunInline(Set.of(1L, 2L));
        given(bookingRepository.findByIdForUpdate(3L)).willReturn(Optional.of(third));

        SweepResult result = sweeper.sweep(T0.plusHours(1));

        assertThat(result.expiredIds()).containsExactly(3L);
        assertThat(result.failedCount()).isEqualTo(2);
        assertThat(third.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(third.getPaymentStatus()).isEqualTo(BookingPaymentStatus.EXPIRED);
    }

    @Test
    void sweep_runTwice_secondRunExpiresNothing() {
        Booking booking = TestFixtures.createBooking(1L, T0);
        givenCandidates(candidate(1L, T0));
        givenMutationsRunInline(Set.of());
        given(bookingRepository.findByIdForUpdate(1L)).willReturn(Optional.of(booking));

        sweeper.sweep(T0.plusHours(1));
        SweepResult second = sweeper.sweep(T0.plusHours(1));

        assertThat(second.expiredCount()).isZero();
        verify(auditRecorder, times(1)).recordChange(anyString(), anyString(), any(), any(), any());
    }

    @Test
    void sweep_noCandidates_returnsEmpty() {
        given(bookingJooqRepository.findExpirationCandidates(any(), isNull(), anyInt())).willReturn(List.of());

        assertThat(sweeper.sweep().expiredCount()).isZero();
        verifyNoInteractions(mutationExecutor);
    }

    private void givenCandidates(ExpirationCandidate... candidates) {
        given(bookingJooqRepository.findExpirationCandidates(any(), isNull(), anyInt()))
                .willReturn(List.of(candidates));
    }

    private void givenMutationsRunInline(Set<Long> lockedIds) {
        given(mutationExecutor.execute(anyLong(), any())).willAnswer(inv -> {
            if (lockedIds.contains(inv.getArgument(0, Long.class))) {
                throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED);
            }
            return inv.getArgument(1, Supplier.class).get();
        });
    }

    private static ExpirationCandidate candidate(Long id, LocalDateTime createdAt) {
        return new ExpirationCandidate(id, createdAt);
    }
}
