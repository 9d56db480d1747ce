package com.innstay.booking.dto.response;

import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BookingStatusResponse(
        Long bookingId,
        String shortRef,
        BookingStatus status,
        BookingPaymentStatus paymentStatus,
        BigDecimal amountDue,
        LocalDateTime updatedAt
) {
    public static BookingStatusResponse from(Booking booking) {
        return new BookingStatusResponse(booking.getId(), booking.getShortRef(), booking.getStatus(),
                booking.getPaymentStatus(), booking.getAmountDue(), booking.getUpdatedAt());
    }
}
