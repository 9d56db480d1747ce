package com.innstay.booking.token;

import com.innstay.booking.config.BookingProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Keyed hashing for verification tokens, so a leaked token table cannot be
 * replayed without the key. Also offers constant-time comparison for shared
 * secrets.
 */
@Component
public class TokenHasher {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public TokenHasher(BookingProperties properties) {
        String secret = properties.getToken().getHashingKey();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("booking.token.hashing-key must be configured");
        }
        this.key = new SecretKeySpec(deriveKey(secret), ALGORITHM);
    }

    public String hash(String token) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(token.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to hash verification token", e);
        }
    }

    public boolean matches(String token, String expectedHash) {
        if (token == null || expectedHash == null) {
            return false;
        }
        return constantTimeEquals(hash(token), expectedHash);
    }

    /**
     * Compares a caller-supplied secret with the configured one. A blank
     * configured secret never matches.
     */
    public static boolean secretsMatch(String supplied, String expected) {
        if (supplied == null || expected == null || expected.isBlank()) {
            return false;
        }
        return constantTimeEquals(supplied, expected);
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    // 256-bit key regardless of configured secret length
    private static byte[] deriveKey(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
