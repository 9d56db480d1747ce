package com.innstay.booking.audit;

import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Completeness and value-capture rules for audit entries. Identity fields are
 * checked in the order action, entityType, entityId.
 */
@Component
public class AuditValidator {

    public Optional<String> findViolation(AuditContext context) {
        if (context.action() == null) {
            return Optional.of("Audit action is required");
        }
        if (isBlank(context.entityType())) {
            return Optional.of("Audit entityType is required");
        }
        if (isBlank(context.entityId())) {
            return Optional.of("Audit entityId is required");
        }

        AuditAction action = context.action();
        return switch (action.valueCapture()) {
            case NONE -> Optional.empty();
            case NEW_VALUES -> context.newValues().isEmpty()
                    ? Optional.of(action + " requires newValues")
                    : Optional.empty();
            case OLD_VALUES -> context.oldValues().isEmpty()
                    ? Optional.of(action + " requires oldValues")
                    : Optional.empty();
            case BOTH -> context.oldValues().isEmpty() || context.newValues().isEmpty()
                    ? Optional.of(action + " requires both oldValues and newValues")
                    : Optional.empty();
        };
    }

    public void validate(AuditContext context) {
        findViolation(context).ifPresent(message -> {
            throw new BusinessException(ErrorCode.INVALID_AUDIT_ENTRY, message);
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
