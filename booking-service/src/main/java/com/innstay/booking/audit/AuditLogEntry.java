package com.innstay.booking.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Append-only audit row. Each entry carries the hash of the previous entry for
 * the same entity, so edits or deletions break the chain.
 */
@Entity
@Immutable
@Table(name = "audit_log",
        indexes = @Index(name = "idx_audit_log_entity", columnList = "entityType, entityId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AuditAction action;

    @Column(nullable = false, length = 50)
    private String entityType;

    @Column(nullable = false, length = 64)
    private String entityId;

    private Long actorId;

    @Column(columnDefinition = "text")
    private String oldValues;

    @Column(columnDefinition = "text")
    private String newValues;

    @Column(nullable = false, length = 64)
    private String previousHash;

    @Column(nullable = false, length = 64)
    private String entryHash;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    AuditLogEntry(AuditAction action, String entityType, String entityId, Long actorId,
                  String oldValues, String newValues, String previousHash, String entryHash,
                  LocalDateTime createdAt) {
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.actorId = actorId;
        this.oldValues = oldValues;
        this.newValues = newValues;
        this.previousHash = previousHash;
        this.entryHash = entryHash;
        this.createdAt = createdAt;
    }
}
