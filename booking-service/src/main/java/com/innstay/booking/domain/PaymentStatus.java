package com.innstay.booking.domain;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    EXPIRED,
    REFUNDED
}
