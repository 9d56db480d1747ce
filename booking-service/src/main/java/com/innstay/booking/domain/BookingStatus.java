package com.innstay.booking.domain;

public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED;

    public boolean isTerminal() {
        return switch (this) {
            case PENDING, CONFIRMED -> false;
            case CANCELLED, COMPLETED -> true;
        };
    }
}
