package com.innstay.booking.payment;

import com.innstay.booking.dto.response.CheckoutResponse;

/**
 * Outcome of the checkout preconditions: either an open session to hand out
 * again, or the request for a new one.
 */
record CheckoutPlan(CheckoutResponse reusable, PaymentGatewayClient.CheckoutSessionRequest request) {

    static CheckoutPlan reuse(CheckoutResponse existing) {
        return new CheckoutPlan(existing, null);
    }

    static CheckoutPlan create(PaymentGatewayClient.CheckoutSessionRequest request) {
        return new CheckoutPlan(null, request);
    }

    boolean isReuse() {
        return reusable != null;
    }
}
