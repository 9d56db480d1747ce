package com.innstay.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Base of every event on the booking topics. {@code eventId} is the consumer
 * deduplication key; {@code schemaVersion} lets a consumer refuse payloads
 * newer than it understands instead of misreading them.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DomainEvent {

    public static final int SCHEMA_VERSION = 1;

    private String eventId;
    private String eventType;
    private int schemaVersion;
    private Instant occurredAt;

    protected DomainEvent(String eventType) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.schemaVersion = SCHEMA_VERSION;
        this.occurredAt = Instant.now();
    }

    public boolean isReadable() {
        return schemaVersion <= SCHEMA_VERSION;
    }
}
