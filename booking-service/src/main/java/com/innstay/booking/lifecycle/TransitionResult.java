package com.innstay.booking.lifecycle;

import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;

public record TransitionResult(
        BookingStatus previousStatus,
        BookingPaymentStatus previousPaymentStatus,
        BookingStatus status,
        BookingPaymentStatus paymentStatus,
        boolean changed
) {
}
