package com.innstay.booking.domain;

/**
 * Financial state of a booking. EXPIRED marks a booking cancelled by the
 * expiration sweep before any money was collected.
 */
public enum BookingPaymentStatus {
    UNPAID,
    PARTIALLY_PAID,
    PAID,
    REFUNDED,
    FAILED,
    EXPIRED
}
