package com.innstay.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Booking state notifications. Status values travel as enum names so that
 * consumers do not depend on the booking-service domain model.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String TYPE_CREATED = "BOOKING_CREATED";
    public static final String TYPE_STATUS_CHANGED = "BOOKING_STATUS_CHANGED";
    public static final String TYPE_ACCESS_REQUESTED = "BOOKING_ACCESS_REQUESTED";

    private Long bookingId;
    private String shortRef;
    private String status;
    private String paymentStatus;
    private String previousStatus;
    private String previousPaymentStatus;
    private String trigger;
    private BigDecimal totalAmount;
    private BigDecimal amountDue;
    private String guestEmail;
    private String accessToken;
    private LocalDateTime accessExpiresAt;

    private BookingEvent(String eventType, Long bookingId, String shortRef) {
        super(eventType);
        this.bookingId = bookingId;
        this.shortRef = shortRef;
    }

    public static BookingEvent created(Long bookingId, String shortRef, String status,
                                       String paymentStatus, BigDecimal totalAmount) {
        BookingEvent event = new BookingEvent(TYPE_CREATED, bookingId, shortRef);
        event.status = status;
        event.paymentStatus = paymentStatus;
        event.totalAmount = totalAmount;
        event.amountDue = totalAmount;
        return event;
    }

    public static BookingEvent statusChanged(Long bookingId, String shortRef,
                                             String previousStatus, String previousPaymentStatus,
                                             String status, String paymentStatus,
                                             String trigger, BigDecimal amountDue) {
        BookingEvent event = new BookingEvent(TYPE_STATUS_CHANGED, bookingId, shortRef);
        event.previousStatus = previousStatus;
        event.previousPaymentStatus = previousPaymentStatus;
        event.status = status;
        event.paymentStatus = paymentStatus;
        event.trigger = trigger;
        event.amountDue = amountDue;
        return event;
    }

    public static BookingEvent accessRequested(Long bookingId, String shortRef, String guestEmail,
                                               String accessToken, LocalDateTime accessExpiresAt) {
        BookingEvent event = new BookingEvent(TYPE_ACCESS_REQUESTED, bookingId, shortRef);
        event.guestEmail = guestEmail;
        event.accessToken = accessToken;
        event.accessExpiresAt = accessExpiresAt;
        return event;
    }
}
