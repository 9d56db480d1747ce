package com.innstay.booking.token;

public record TokenValidation(boolean valid, boolean expired, Long bookingId) {

    private static final TokenValidation INVALID = new TokenValidation(false, false, null);

    public static TokenValidation invalid() {
        return INVALID;
    }

    public static TokenValidation expired(Long bookingId) {
        return new TokenValidation(false, true, bookingId);
    }

    public static TokenValidation valid(Long bookingId) {
        return new TokenValidation(true, false, bookingId);
    }
}
