package com.innstay.booking.lifecycle;

import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends BusinessException {

    private final LifecycleAction action;
    private final BookingStatus status;
    private final BookingPaymentStatus paymentStatus;

    public InvalidTransitionException(LifecycleAction action, BookingStatus status,
                                      BookingPaymentStatus paymentStatus, String detail) {
        super(ErrorCode.INVALID_TRANSITION,
                "Cannot " + action + " booking in " + status + "/" + paymentStatus + ": " + detail);
        this.action = action;
        this.status = status;
        this.paymentStatus = paymentStatus;
    }
}
