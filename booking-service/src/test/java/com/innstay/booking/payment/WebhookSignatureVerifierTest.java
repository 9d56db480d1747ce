package com.innstay.booking.payment;

import com.innstay.booking.config.PaymentGatewayProperties;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSignatureVerifierTest {

    private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");
    private static final String SECRET = "whsk_test_secret";
    private static final String BODY = "{\"data\":{\"id\":\"evt_1\"}}";

    private PaymentGatewayProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new PaymentGatewayProperties();
        properties.setWebhookSecret(SECRET);
        verifier = new WebhookSignatureVerifier(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void verify_validTestModeSignature_passes() {
        long t = NOW.getEpochSecond();
        String header = "t=" + t + ",te=" + WebhookSignatureVerifier.sign(SECRET, t + "." + BODY) + ",li=";

        assertThatCode(() -> verifier.verify(BODY, header)).doesNotThrowAnyException();
    }

    @Test
    void verify_validLiveSignature_passes() {
        long t = NOW.getEpochSecond() - 60;
        String header = "t=" + t + ",te=,li=" + WebhookSignatureVerifier.sign(SECRET, t + "." + BODY);

        assertThatCode(() -> verifier.verify(BODY, header)).doesNotThrowAnyException();
    }

    @Test
    void verify_tamperedBody_rejected() {
        long t = NOW.getEpochSecond();
        String header = "t=" + t + ",te=" + WebhookSignatureVerifier.sign(SECRET, t + "." + BODY);

        assertRejected(BODY.replace("evt_1", "evt_2"), header);
    }

    @Test
    void verify_staleTimestamp_rejected() {
        long t = NOW.getEpochSecond() - 600;
        String header = "t=" + t + ",te=" + WebhookSignatureVerifier.sign(SECRET, t + "." + BODY);

        assertRejected(BODY, header);
    }

    @Test
    void verify_missingHeader_rejected() {
        assertRejected(BODY, null);
        assertRejected(BODY, "te=abc");
    }

    @Test
    void verify_secretNotConfigured_rejected() {
        properties.setWebhookSecret("");
        long t = NOW.getEpochSecond();
        String header = "t=" + t + ",te=" + WebhookSignatureVerifier.sign("other-secret", t + "." + BODY);

        assertRejected(BODY, header);
    }

    @Test
    void verify_secretMissing_rejectedWithoutSigning() {
        properties.setWebhookSecret(null);
        long t = NOW.getEpochSecond();
        String header = "t=" + t + ",te=" + WebhookSignatureVerifier.sign(SECRET, t + "." + BODY);

        assertRejected(BODY, header);
    }

    private void assertRejected(String body, String header) {
        assertThatThrownBy(() -> verifier.verify(body, header))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_SIGNATURE);
    }
}
