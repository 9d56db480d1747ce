package com.innstay.booking.payment;

import com.innstay.booking.config.PaymentGatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Simulated payment provider for development and testing. Sessions never
 * settle on their own; settlement is driven through the webhook endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "payment.gateway", name = "provider", havingValue = "mock", matchIfMissing = true)
public class MockPaymentGatewayClient implements PaymentGatewayClient {

    private final PaymentGatewayProperties properties;

    @Override
    public String providerName() {
        return "MOCK";
    }

    @Override
    public CheckoutSession createCheckoutSession(CheckoutSessionRequest request) {
        String sessionId = "cs_mock_" + UUID.randomUUID().toString().replace("-", "");
        log.info("Mock checkout session: bookingId={}, amount={} {}, sessionId={}",
                request.bookingId(), request.amount(), request.currency(), sessionId);
        return new CheckoutSession(sessionId, properties.getSuccessUrl() + "?session=" + sessionId);
    }

    @Override
    public SessionStatus fetchSessionStatus(String sessionId) {
        return SessionStatus.pending(sessionId);
    }
}
