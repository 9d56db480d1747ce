package com.innstay.booking.payment;

import java.math.BigDecimal;

/**
 * Boundary to the external payment provider.
 * Implementations: MockPaymentGatewayClient (dev), PayMongoGatewayClient (production).
 * <p>
 * Implementations report provider failures as a {@code BusinessException}
 * with {@code PAYMENT_GATEWAY_ERROR}, which callers may retry.
 */
public interface PaymentGatewayClient {

    String providerName();

    CheckoutSession createCheckoutSession(CheckoutSessionRequest request);

    SessionStatus fetchSessionStatus(String sessionId);

    record CheckoutSessionRequest(
            Long bookingId,
            String shortRef,
            BigDecimal amount,
            String currency,
            String description,
            String customerName,
            String customerEmail
    ) {
    }

    record CheckoutSession(String sessionId, String checkoutUrl) {
    }

    record SessionStatus(String sessionId, SessionOutcome outcome, String paymentReference,
                         BigDecimal amountPaid, String failureReason) {

        public static SessionStatus pending(String sessionId) {
            return new SessionStatus(sessionId, SessionOutcome.PENDING, null, null, null);
        }
    }

    enum SessionOutcome {
        PENDING, PAID, FAILED, EXPIRED
    }
}
