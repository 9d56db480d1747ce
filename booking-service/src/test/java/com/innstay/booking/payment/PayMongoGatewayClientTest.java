package com.innstay.booking.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PayMongoGatewayClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void toSessionStatus_paidPayment_paidWithAmountInPesos() throws Exception {
        JsonNode session = objectMapper.readTree("""
                {"id":"cs_1","attributes":{"status":"active","payments":[
                  {"id":"pay_fail","attributes":{"status":"failed","amount":244000}},
                  {"id":"pay_ok","attributes":{"status":"paid","amount":244000}}
                ]}}
                """);

        PaymentGatewayClient.SessionStatus status = PayMongoGatewayClient.toSessionStatus("cs_1", session);

        assertThat(status.outcome()).isEqualTo(PaymentGatewayClient.SessionOutcome.PAID);
        assertThat(status.paymentReference()).isEqualTo("pay_ok");
        assertThat(status.amountPaid()).isEqualByComparingTo("2440.00");
    }

    @Test
    void toSessionStatus_onlyFailedPayment_failedWithProviderMessage() throws Exception {
        JsonNode session = objectMapper.readTree("""
                {"id":"cs_1","attributes":{"status":"active","payments":[
                  {"id":"pay_1","attributes":{"status":"failed",
                    "last_payment_error":{"failed_message":"Card declined"}}}
                ]}}
                """);

        PaymentGatewayClient.SessionStatus status = PayMongoGatewayClient.toSessionStatus("cs_1", session);

        assertThat(status.outcome()).isEqualTo(PaymentGatewayClient.SessionOutcome.FAILED);
        assertThat(status.failureReason()).isEqualTo("Card declined");
    }

    @Test
    void toSessionStatus_expiredSessionWithoutPayments_expired() throws Exception {
        JsonNode session = objectMapper.readTree("""
                {"id":"cs_1","attributes":{"status":"expired","payments":[]}}
                """);

        assertThat(PayMongoGatewayClient.toSessionStatus("cs_1", session).outcome())
                .isEqualTo(PaymentGatewayClient.SessionOutcome.EXPIRED);
    }

    @Test
    void toSessionStatus_activeSessionWithoutPayments_pending() throws Exception {
        JsonNode session = objectMapper.readTree("""
                {"id":"cs_1","attributes":{"status":"active"}}
                """);

        assertThat(PayMongoGatewayClient.toSessionStatus("cs_1", session).outcome())
                .isEqualTo(PaymentGatewayClient.SessionOutcome.PENDING);
    }

    @Test
    void toCentavos_roundsToWholeCentavos() {
        assertThat(PayMongoGatewayClient.toCentavos(new BigDecimal("2440.00"))).isEqualTo(244000L);
        assertThat(PayMongoGatewayClient.toCentavos(new BigDecimal("10.005"))).isEqualTo(1001L);
        assertThat(PayMongoGatewayClient.fromCentavos(1001L)).isEqualByComparingTo("10.01");
    }
}
