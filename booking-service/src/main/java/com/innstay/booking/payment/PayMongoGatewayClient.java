package com.innstay.booking.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.innstay.booking.config.PaymentGatewayProperties;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PayMongo checkout sessions. Amounts are sent in centavos.
 * <p>
 * Session creation is not retried, since a retry after a timeout could open a
 * second session at the provider; status reads are.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "payment.gateway", name = "provider", havingValue = "paymongo")
public class PayMongoGatewayClient implements PaymentGatewayClient {

    private final RestClient restClient;
    private final PaymentGatewayProperties properties;

    public PayMongoGatewayClient(RestClient.Builder builder, PaymentGatewayProperties properties) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());

        String credentials = Base64.getEncoder()
                .encodeToString((properties.getSecretKey() + ":").getBytes(StandardCharsets.UTF_8));
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .build();
    }

    @Override
    public String providerName() {
        return "PAYMONGO";
    }

    @Override
    @CircuitBreaker(name = "paymentGateway", fallbackMethod = "createCheckoutSessionFallback")
    public CheckoutSession createCheckoutSession(CheckoutSessionRequest request) {
        Map<String, Object> lineItem = new LinkedHashMap<>();
        lineItem.put("currency", request.currency());
        lineItem.put("amount", toCentavos(request.amount()));
        lineItem.put("name", "Booking " + request.shortRef());
        lineItem.put("description", request.description());
        lineItem.put("quantity", 1);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("line_items", List.of(lineItem));
        attributes.put("payment_method_types", properties.getPaymentMethodTypes());
        attributes.put("reference_number", request.shortRef());
        attributes.put("description", request.description());
        attributes.put("send_email_receipt", true);
        attributes.put("show_description", true);
        attributes.put("show_line_items", true);
        attributes.put("success_url", properties.getSuccessUrl() + "?id=" + request.bookingId());
        attributes.put("cancel_url", properties.getCancelUrl());
        attributes.put("billing", Map.of("name", request.customerName(), "email", request.customerEmail()));
        attributes.put("metadata", Map.of(
                "booking_id", String.valueOf(request.bookingId()),
                "booking_number", request.shortRef()));

        JsonNode response = restClient.post()
                .uri("/checkout_sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("data", Map.of("attributes", attributes)))
                .retrieve()
                .body(JsonNode.class);

        JsonNode data = requireData(response);
        String sessionId = data.path("id").asText();
        String checkoutUrl = data.path("attributes").path("checkout_url").asText();
        log.info("PayMongo checkout session created: bookingId={}, sessionId={}", request.bookingId(), sessionId);
        return new CheckoutSession(sessionId, checkoutUrl);
    }

    @Override
    @Retry(name = "paymentGateway")
    @CircuitBreaker(name = "paymentGateway", fallbackMethod = "fetchSessionStatusFallback")
    public SessionStatus fetchSessionStatus(String sessionId) {
        JsonNode response = restClient.get()
                .uri("/checkout_sessions/{id}", sessionId)
                .retrieve()
                .body(JsonNode.class);
        return toSessionStatus(sessionId, requireData(response));
    }

    static SessionStatus toSessionStatus(String sessionId, JsonNode session) {
        JsonNode attributes = session.path("attributes");
        JsonNode failed = null;
        for (JsonNode payment : attributes.path("payments")) {
            String status = payment.path("attributes").path("status").asText();
            if ("paid".equals(status)) {
                return new SessionStatus(sessionId, SessionOutcome.PAID, payment.path("id").asText(),
                        fromCentavos(payment.path("attributes").path("amount").asLong()), null);
            }
            if ("failed".equals(status)) {
                failed = payment;
            }
        }
        if (failed != null) {
            String reason = failed.path("attributes").path("last_payment_error").path("failed_message")
                    .asText("Payment failed");
            return new SessionStatus(sessionId, SessionOutcome.FAILED, failed.path("id").asText(), null, reason);
        }
        if ("expired".equals(attributes.path("status").asText())) {
            return new SessionStatus(sessionId, SessionOutcome.EXPIRED, null, null, "Checkout session expired");
        }
        return SessionStatus.pending(sessionId);
    }

    static long toCentavos(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    static BigDecimal fromCentavos(long centavos) {
        return BigDecimal.valueOf(centavos).movePointLeft(2);
    }

    private static JsonNode requireData(JsonNode response) {
        if (response == null || response.path("data").isMissingNode()) {
            throw new IllegalStateException("PayMongo response without data");
        }
        return response.path("data");
    }

    @SuppressWarnings("unused")
    private CheckoutSession createCheckoutSessionFallback(CheckoutSessionRequest request, Throwable t) {
        log.error("PayMongo checkout session failed: bookingId={}", request.bookingId(), t);
        throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                ErrorCode.PAYMENT_GATEWAY_ERROR.getMessage(), t);
    }

    @SuppressWarnings("unused")
    private SessionStatus fetchSessionStatusFallback(String sessionId, Throwable t) {
        log.error("PayMongo session lookup failed: sessionId={}", sessionId, t);
        throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR,
                ErrorCode.PAYMENT_GATEWAY_ERROR.getMessage(), t);
    }
}
