package com.innstay.booking.service;

import com.innstay.booking.audit.AuditChainVerifier;
import com.innstay.booking.audit.AuditLogRepository;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.dto.response.AuditTrailResponse;
import com.innstay.booking.dto.response.BookingResponse;
import com.innstay.booking.dto.response.BookingStatusResponse;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.security.BookingAccessGuard;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService {

    private final BookingRepository bookingRepository;
    private final BookingAccessGuard accessGuard;
    private final AuditLogRepository auditLogRepository;
    private final AuditChainVerifier auditChainVerifier;

    public BookingResponse getBooking(Long bookingId, ActorContext actor, String token) {
        return BookingResponse.from(loadAuthorized(bookingId, actor, token));
    }

    /**
     * Lightweight view for the payment confirmation page, which polls until
     * the provider callback has been applied.
     */
    public BookingStatusResponse getStatus(Long bookingId, ActorContext actor, String token) {
        return BookingStatusResponse.from(loadAuthorized(bookingId, actor, token));
    }

    public AuditTrailResponse getAuditTrail(Long bookingId, ActorContext actor) {
        if (!actor.isStaff()) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Audit trail is restricted to staff");
        }
        if (!bookingRepository.existsById(bookingId)) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
        }
        String entityId = String.valueOf(bookingId);
        List<AuditTrailResponse.Entry> entries = auditLogRepository
                .findByEntityTypeAndEntityIdOrderByIdAsc(BookingTransactionService.ENTITY_TYPE, entityId)
                .stream()
                .map(AuditTrailResponse.Entry::from)
                .toList();
        boolean intact = auditChainVerifier.verify(BookingTransactionService.ENTITY_TYPE, entityId).intact();
        return new AuditTrailResponse(BookingTransactionService.ENTITY_TYPE, entityId, intact, entries);
    }

    private Booking loadAuthorized(Long bookingId, ActorContext actor, String token) {
        Booking booking = bookingRepository.findWithItemsById(bookingId)
                .orElseThrow(() -> accessGuard.notFound(actor, bookingId));
        accessGuard.authorize(booking, actor, token);
        return booking;
    }
}
