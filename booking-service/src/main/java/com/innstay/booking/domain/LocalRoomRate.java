package com.innstay.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Local replica of a room's current nightly rate, synced via Kafka from the
 * property service. Read-only in this service and the only rate source used
 * for pricing.
 */
@Entity
@Table(name = "local_room_rates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LocalRoomRate implements Persistable<Long> {

    @Id
    private Long roomId;

    @Column(nullable = false, length = 100)
    private String roomName;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal nightlyRate;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private LocalDateTime syncedAt;

    @Transient
    private boolean isNew = true;

    public LocalRoomRate(Long roomId, String roomName, BigDecimal nightlyRate,
                         String currency, boolean active, LocalDateTime syncedAt) {
        this.roomId = roomId;
        this.roomName = roomName;
        this.nightlyRate = nightlyRate;
        this.currency = currency;
        this.active = active;
        this.syncedAt = syncedAt;
    }

    @Override
    public Long getId() {
        return roomId;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PrePersist
    void markNotNew() {
        this.isNew = false;
    }

    public void updateFrom(String roomName, BigDecimal nightlyRate, String currency,
                           boolean active, LocalDateTime syncedAt) {
        this.roomName = roomName;
        this.nightlyRate = nightlyRate;
        this.currency = currency;
        this.active = active;
        this.syncedAt = syncedAt;
    }
}
