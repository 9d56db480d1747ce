package com.innstay.booking.lifecycle;

import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * A booking expires when it is still PENDING and UNPAID and was created
 * strictly before {@code now - threshold}. Partially paid and failed bookings
 * are never expired.
 */
@Component
@RequiredArgsConstructor
public class BookingExpirationPolicy {

    private final BookingProperties properties;

    public LocalDateTime cutoff(LocalDateTime now) {
        return now.minus(properties.getExpiration().getThreshold());
    }

    public boolean isEligible(Booking booking, LocalDateTime now) {
        return booking.getStatus() == BookingStatus.PENDING
                && booking.getPaymentStatus() == BookingPaymentStatus.UNPAID
                && booking.getCreatedAt() != null
                && booking.getCreatedAt().isBefore(cutoff(now));
    }
}
