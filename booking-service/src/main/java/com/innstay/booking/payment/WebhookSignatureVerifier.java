package com.innstay.booking.payment;

import com.innstay.booking.config.PaymentGatewayProperties;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Verifies the {@code Paymongo-Signature} header, formatted as
 * {@code t=<unix seconds>,te=<test signature>,li=<live signature>}. The
 * signature is HMAC-SHA256 over {@code t + "." + rawBody} keyed with the
 * webhook secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    public static final String HEADER = "Paymongo-Signature";

    private static final String ALGORITHM = "HmacSHA256";

    private final PaymentGatewayProperties properties;
    private final Clock clock;

    public void verify(String rawBody, String signatureHeader) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook rejected: payment.gateway.webhook-secret is not configured");
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE);
        }
        if (rawBody == null || signatureHeader == null || signatureHeader.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE);
        }

        Map<String, String> parts = parseHeader(signatureHeader);
        String timestamp = parts.get("t");
        if (timestamp == null || !isFresh(timestamp)) {
            log.warn("Webhook rejected: missing or stale timestamp t={}", timestamp);
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE);
        }

        byte[] expected = sign(secret, timestamp + "." + rawBody).getBytes(StandardCharsets.UTF_8);
        if (!matches(parts.get("li"), expected) && !matches(parts.get("te"), expected)) {
            log.warn("Webhook rejected: signature mismatch");
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE);
        }
    }

    static String sign(String secret, String content) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(content.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute webhook signature", e);
        }
    }

    private boolean isFresh(String timestamp) {
        long seconds;
        try {
            seconds = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        Duration age = Duration.between(Instant.ofEpochSecond(seconds), clock.instant()).abs();
        return age.compareTo(properties.getSignatureTolerance()) <= 0;
    }

    private static boolean matches(String supplied, byte[] expected) {
        if (supplied == null || supplied.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(supplied.trim().getBytes(StandardCharsets.UTF_8), expected);
    }

    private static Map<String, String> parseHeader(String header) {
        Map<String, String> parts = new HashMap<>();
        for (String part : header.split(",")) {
            int eq = part.indexOf('=');
            if (eq > 0) {
                parts.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
            }
        }
        return parts;
    }
}
