package com.innstay.booking.security;

/**
 * The basis on which a caller was allowed to act on a booking.
 */
public enum AccessGrant {
    OWNER,
    STAFF,
    TOKEN,
    SYSTEM
}
