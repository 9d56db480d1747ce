package com.innstay.booking.payment;

public enum SettlementOutcome {
    APPLIED,
    /** Paid after the booking was already cancelled or completed; a refund was requested. */
    LATE_PAYMENT,
    /** The payment had already left PENDING. */
    ALREADY_APPLIED,
    DUPLICATE,
    UNKNOWN_SESSION,
    STILL_PENDING
}
