package com.innstay.booking.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Marker row for a consumed Kafka event or a provider webhook delivery.
 * {@code source} is the topic or webhook channel the id came from.
 */
@Entity
@Table(name = "processed_events",
        indexes = @Index(name = "idx_processed_events_processed_at", columnList = "processedAt"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEvent {

    @Id
    @Column(length = 100)
    private String eventId;

    @Column(nullable = false, length = 100)
    private String source;

    @Column(nullable = false)
    private LocalDateTime processedAt;

    public ProcessedEvent(String eventId, String source, LocalDateTime processedAt) {
        this.eventId = eventId;
        this.source = source;
        this.processedAt = processedAt;
    }
}
