package com.innstay.booking.audit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * SHA-256 chaining for audit entries of a single entity.
 */
final class AuditHashChain {

    static final String GENESIS = "0".repeat(64);

    private static final char SEPARATOR = '\u001F';

    private AuditHashChain() {
    }

    static String hash(String previousHash, AuditAction action, String entityType, String entityId,
                       Long actorId, String oldValues, String newValues, LocalDateTime createdAt) {
        StringBuilder material = new StringBuilder()
                .append(previousHash).append(SEPARATOR)
                .append(action.name()).append(SEPARATOR)
                .append(entityType).append(SEPARATOR)
                .append(entityId).append(SEPARATOR)
                .append(actorId == null ? "" : actorId).append(SEPARATOR)
                .append(oldValues == null ? "" : oldValues).append(SEPARATOR)
                .append(newValues == null ? "" : newValues).append(SEPARATOR)
                .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(createdAt));
        return sha256Hex(material.toString());
    }

    static String hashOf(AuditLogEntry entry) {
        return hash(entry.getPreviousHash(), entry.getAction(), entry.getEntityType(), entry.getEntityId(),
                entry.getActorId(), entry.getOldValues(), entry.getNewValues(), entry.getCreatedAt());
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
