package com.innstay.booking.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Writes validated, hash-chained audit entries in the caller's transaction.
 * Callers that mutate an entity hold that entity's lock, which keeps the chain
 * for one entity linear.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditRecorder {

    private final AuditLogRepository auditLogRepository;
    private final AuditValidator auditValidator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public AuditLogEntry record(AuditContext context) {
        auditValidator.validate(context);

        String oldJson = toJson(context.oldValues());
        String newJson = toJson(context.newValues());
        LocalDateTime createdAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);

        String previousHash = auditLogRepository
                .findTopByEntityTypeAndEntityIdOrderByIdDesc(context.entityType(), context.entityId())
                .map(AuditLogEntry::getEntryHash)
                .orElse(AuditHashChain.GENESIS);
        String entryHash = AuditHashChain.hash(previousHash, context.action(), context.entityType(),
                context.entityId(), context.actorId(), oldJson, newJson, createdAt);

        AuditLogEntry saved = auditLogRepository.save(new AuditLogEntry(
                context.action(), context.entityType(), context.entityId(), context.actorId(),
                oldJson, newJson, previousHash, entryHash, createdAt));

        log.debug("Audit recorded: action={}, entity={}:{}, actorId={}",
                context.action(), context.entityType(), context.entityId(), context.actorId());
        return saved;
    }

    /**
     * Records an UPDATE containing only the fields that differ. Returns empty
     * when nothing changed.
     */
    @Transactional
    public Optional<AuditLogEntry> recordChange(String entityType, String entityId, Long actorId,
                                                AuditSnapshot before, AuditSnapshot after) {
        AuditDiff diff = AuditDiff.between(before, after);
        if (diff.isEmpty()) {
            log.debug("Audit skipped, no changes: entity={}:{}", entityType, entityId);
            return Optional.empty();
        }
        return Optional.of(record(AuditContext.forUpdate(
                entityType, entityId, diff.oldValues(), diff.newValues(), actorId)));
    }

    private String toJson(AuditSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot.values());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit values", e);
        }
    }
}
