package com.innstay.booking.audit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The changed subset of two snapshots. A key missing on one side and null on
 * the other is not a change.
 */
public record AuditDiff(AuditSnapshot oldValues, AuditSnapshot newValues) {

    public static AuditDiff between(AuditSnapshot before, AuditSnapshot after) {
        Set<String> keys = new TreeSet<>(before.keys());
        keys.addAll(after.keys());

        Map<String, Object> changedOld = new LinkedHashMap<>();
        Map<String, Object> changedNew = new LinkedHashMap<>();
        for (String key : keys) {
            Object oldValue = before.get(key);
            Object newValue = after.get(key);
            if (!Objects.equals(oldValue, newValue)) {
                changedOld.put(key, oldValue);
                changedNew.put(key, newValue);
            }
        }
        return new AuditDiff(AuditSnapshot.of(changedOld), AuditSnapshot.of(changedNew));
    }

    public boolean isEmpty() {
        return oldValues.isEmpty() && newValues.isEmpty();
    }
}
