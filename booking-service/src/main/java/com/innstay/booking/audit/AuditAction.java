package com.innstay.booking.audit;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    APPROVE,
    REJECT,
    RECEIVE,
    TRANSFER,
    ADJUST,
    WASTE,
    VOID,
    CANCEL;

    public ValueCapture valueCapture() {
        return switch (this) {
            case CREATE -> ValueCapture.NEW_VALUES;
            case DELETE -> ValueCapture.OLD_VALUES;
            case UPDATE -> ValueCapture.BOTH;
            case APPROVE, REJECT, RECEIVE, TRANSFER, ADJUST, WASTE, VOID, CANCEL -> ValueCapture.NONE;
        };
    }

    public enum ValueCapture {
        NONE, NEW_VALUES, OLD_VALUES, BOTH
    }
}
