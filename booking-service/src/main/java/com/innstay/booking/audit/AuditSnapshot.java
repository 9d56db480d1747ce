package com.innstay.booking.audit;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Redacted, normalized field-to-value record of an entity at one point in time.
 * <p>
 * Keys that look like credentials (password, token, secret, api key) are
 * dropped on construction. Temporal values become ISO-8601 text, decimals lose
 * trailing zeros, small integral types widen to {@code Long} and enums become
 * their names, so two snapshots of the same state compare equal.
 */
public final class AuditSnapshot {

    private static final List<String> SENSITIVE_KEY_FRAGMENTS =
            List.of("password", "passwd", "token", "secret", "apikey", "api_key");

    private static final AuditSnapshot EMPTY = new AuditSnapshot(Collections.emptySortedMap());

    private final SortedMap<String, Object> values;

    private AuditSnapshot(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static AuditSnapshot empty() {
        return EMPTY;
    }

    public static AuditSnapshot of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        return new AuditSnapshot(normalizeMap(raw));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isSensitiveKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEY_FRAGMENTS.stream().anyMatch(lower::contains);
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static SortedMap<String, Object> normalizeMap(Map<?, ?> raw) {
        SortedMap<String, Object> normalized = new TreeMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String key = String.valueOf(entry.getKey());
            if (isSensitiveKey(key)) {
                continue;
            }
            normalized.put(key, normalizeValue(entry.getValue()));
        }
        return normalized;
    }

    static Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime);
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof ZonedDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof BigDecimal decimal) {
            return new BigDecimal(decimal.stripTrailingZeros().toPlainString());
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Map<?, ?> nested) {
            return Collections.unmodifiableSortedMap(normalizeMap(nested));
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(AuditSnapshot::normalizeValue).toList();
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuditSnapshot other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AuditSnapshot" + values;
    }

    public static final class Builder {

        private final Map<String, Object> raw = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            raw.put(key, value);
            return this;
        }

        public AuditSnapshot build() {
            return AuditSnapshot.of(raw);
        }
    }
}
