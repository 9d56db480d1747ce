package com.innstay.booking.security;

public enum ActorRole {
    GUEST,
    STAFF,
    ADMIN,
    SYSTEM;

    /** Unknown or missing role headers resolve to GUEST. */
    public static ActorRole fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return GUEST;
        }
        return switch (value.trim().toUpperCase()) {
            case "STAFF" -> STAFF;
            case "ADMIN" -> ADMIN;
            default -> GUEST;
        };
    }
}
