package com.innstay.booking.audit;

/**
 * Everything needed to write one audit entry. {@code actorId} is null for
 * system actions such as the expiration sweep.
 */
public record AuditContext(
        AuditAction action,
        String entityType,
        String entityId,
        AuditSnapshot oldValues,
        AuditSnapshot newValues,
        Long actorId
) {

    public AuditContext {
        oldValues = oldValues == null ? AuditSnapshot.empty() : oldValues;
        newValues = newValues == null ? AuditSnapshot.empty() : newValues;
    }

    public static AuditContext forCreate(String entityType, String entityId,
                                         AuditSnapshot newValues, Long actorId) {
        return new AuditContext(AuditAction.CREATE, entityType, entityId, null, newValues, actorId);
    }

    public static AuditContext forUpdate(String entityType, String entityId,
                                         AuditSnapshot oldValues, AuditSnapshot newValues, Long actorId) {
        return new AuditContext(AuditAction.UPDATE, entityType, entityId, oldValues, newValues, actorId);
    }

    public static AuditContext forDelete(String entityType, String entityId,
                                         AuditSnapshot oldValues, Long actorId) {
        return new AuditContext(AuditAction.DELETE, entityType, entityId, oldValues, null, actorId);
    }
}
