package com.innstay.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEvent extends DomainEvent {

    public static final String TYPE_SETTLED = "PAYMENT_SETTLED";
    public static final String TYPE_FAILED = "PAYMENT_FAILED";
    public static final String TYPE_REFUND_REQUIRED = "PAYMENT_REFUND_REQUIRED";

    private Long paymentId;
    private Long bookingId;
    private String externalId;
    private BigDecimal amount;
    private String currency;
    private String reason;

    private PaymentEvent(String eventType, Long paymentId, Long bookingId, String externalId,
                         BigDecimal amount, String currency, String reason) {
        super(eventType);
        this.paymentId = paymentId;
        this.bookingId = bookingId;
        this.externalId = externalId;
        this.amount = amount;
        this.currency = currency;
        this.reason = reason;
    }

    public static PaymentEvent settled(Long paymentId, Long bookingId, String externalId,
                                       BigDecimal amount, String currency) {
        return new PaymentEvent(TYPE_SETTLED, paymentId, bookingId, externalId, amount, currency, null);
    }

    public static PaymentEvent failed(Long paymentId, Long bookingId, String externalId, String reason) {
        return new PaymentEvent(TYPE_FAILED, paymentId, bookingId, externalId, null, null, reason);
    }

    public static PaymentEvent refundRequired(Long paymentId, Long bookingId, String externalId,
                                              BigDecimal amount, String currency, String reason) {
        return new PaymentEvent(TYPE_REFUND_REQUIRED, paymentId, bookingId, externalId, amount, currency, reason);
    }
}
