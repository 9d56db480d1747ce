package com.innstay.booking.payment;

import java.math.BigDecimal;

/**
 * A provider-reported outcome for one checkout session. eventId is the
 * provider's delivery id for webhooks and null for reconciliation polls.
 */
public record SettlementCommand(
        String eventId,
        String sessionId,
        PaymentGatewayClient.SessionOutcome outcome,
        String paymentReference,
        BigDecimal amount,
        String failureReason
) {

    public static SettlementCommand fromStatus(PaymentGatewayClient.SessionStatus status) {
        return new SettlementCommand(null, status.sessionId(), status.outcome(),
                status.paymentReference(), status.amountPaid(), status.failureReason());
    }
}
