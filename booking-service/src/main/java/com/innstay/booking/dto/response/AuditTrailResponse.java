package com.innstay.booking.dto.response;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.innstay.booking.audit.AuditAction;
import com.innstay.booking.audit.AuditLogEntry;

import java.time.LocalDateTime;
import java.util.List;

public record AuditTrailResponse(
        String entityType,
        String entityId,
        boolean chainIntact,
        List<Entry> entries
) {
    public record Entry(
            Long id,
            AuditAction action,
            Long actorId,
            @JsonRawValue String oldValues,
            @JsonRawValue String newValues,
            String entryHash,
            LocalDateTime createdAt
    ) {
        public static Entry from(AuditLogEntry entry) {
            return new Entry(entry.getId(), entry.getAction(), entry.getActorId(),
                    entry.getOldValues(), entry.getNewValues(), entry.getEntryHash(), entry.getCreatedAt());
        }
    }
}
