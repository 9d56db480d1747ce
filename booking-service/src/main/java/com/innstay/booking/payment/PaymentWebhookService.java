package com.innstay.booking.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for provider callbacks. The signature is checked against the
 * raw body before anything is parsed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookService {

    static final String CHECKOUT_PAID = "checkout_session.payment.paid";

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentSettlementService settlementService;
    private final ObjectMapper objectMapper;

    public Optional<SettlementOutcome> handle(String rawBody, String signatureHeader) {
        signatureVerifier.verify(rawBody, signatureHeader);

        JsonNode event = parse(rawBody).path("data");
        String eventId = event.path("id").asText(null);
        String type = event.path("attributes").path("type").asText("");
        if (!CHECKOUT_PAID.equals(type)) {
            log.info("Ignoring webhook event: eventId={}, type={}", eventId, type);
            return Optional.empty();
        }

        JsonNode session = event.path("attributes").path("data");
        String sessionId = session.path("id").asText(null);
        if (eventId == null || sessionId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Webhook event without event or session id");
        }

        PaymentGatewayClient.SessionStatus status = PayMongoGatewayClient.toSessionStatus(sessionId, session);
        if (status.outcome() != PaymentGatewayClient.SessionOutcome.PAID) {
            // Paid event whose payload has no paid payment; leave it for reconciliation
            log.warn("Paid webhook without a paid payment: eventId={}, sessionId={}", eventId, sessionId);
            return Optional.of(SettlementOutcome.STILL_PENDING);
        }
        SettlementCommand command = new SettlementCommand(eventId, sessionId, status.outcome(),
                status.paymentReference(), status.amountPaid(), null);
        return Optional.of(settlementService.settle(command));
    }

    private JsonNode parse(String rawBody) {
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Malformed webhook payload", e);
        }
    }
}
