package com.innstay.booking.lifecycle;

import com.innstay.booking.security.ActorRole;

/**
 * Every way a booking's status or payment status can change.
 */
public enum LifecycleAction {
    SETTLE_PAYMENT,
    RECORD_PAYMENT_FAILURE,
    CONFIRM,
    CANCEL,
    EXPIRE,
    COMPLETE,
    REFUND;

    public boolean allowedFor(ActorRole role) {
        return switch (this) {
            case SETTLE_PAYMENT, RECORD_PAYMENT_FAILURE, EXPIRE -> role == ActorRole.SYSTEM;
            case CONFIRM, COMPLETE, REFUND -> role == ActorRole.STAFF || role == ActorRole.ADMIN;
            case CANCEL -> true;
        };
    }
}
