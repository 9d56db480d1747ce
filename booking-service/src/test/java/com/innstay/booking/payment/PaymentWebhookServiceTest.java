package com.innstay.booking.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookServiceTest {

    private static final String PAID_EVENT = """
            {"data":{"id":"evt_123","type":"event","attributes":{
              "type":"checkout_session.payment.paid","livemode":false,
              "data":{"id":"cs_abc","type":"checkout_session","attributes":{
                "status":"active","reference_number":"IS-ABC123",
                "payments":[{"id":"pay_789","attributes":{"status":"paid","amount":244000}}]
              }}
            }}}
            """;

    @Mock
    private WebhookSignatureVerifier signatureVerifier;
    @Mock
    private PaymentSettlementService settlementService;

    private PaymentWebhookService webhookService;

    @BeforeEach
    void setUp() {
        webhookService = new PaymentWebhookService(signatureVerifier, settlementService, new ObjectMapper());
    }

    @Test
    void handle_checkoutPaid_settlesSession() {
        given(settlementService.settle(any())).willReturn(SettlementOutcome.APPLIED);

        Optional<SettlementOutcome> outcome = webhookService.handle(PAID_EVENT, "sig");

        assertThat(outcome).contains(SettlementOutcome.APPLIED);
        ArgumentCaptor<SettlementCommand> captor = ArgumentCaptor.forClass(SettlementCommand.class);
        verify(settlementService).settle(captor.capture());
        SettlementCommand command = captor.getValue();
        assertThat(command.eventId()).isEqualTo("evt_123");
        assertThat(command.sessionId()).isEqualTo("cs_abc");
        assertThat(command.paymentReference()).isEqualTo("pay_789");
        assertThat(command.amount()).isEqualByComparingTo("2440.00");
    }

    @Test
    void handle_otherEventType_ignored() {
        String body = """
                {"data":{"id":"evt_9","attributes":{"type":"payment.refunded","data":{"id":"pay_1"}}}}
                """;

        assertThat(webhookService.handle(body, "sig")).isEmpty();
        verifyNoInteractions(settlementService);
    }

    @Test
    void handle_badSignature_nothingParsedOrSettled() {
        willThrow(new BusinessException(ErrorCode.INVALID_SIGNATURE))
                .given(signatureVerifier).verify(PAID_EVENT, "bad");

        assertThatThrownBy(() -> webhookService.handle(PAID_EVENT, "bad"))
                .isInstanceOf(BusinessException.class);
        verifyNoInteractions(settlementService);
    }

    @Test
    void handle_malformedJson_invalidInput() {
        assertThatThrownBy(() -> webhookService.handle("{not json", "sig"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
    }
}
