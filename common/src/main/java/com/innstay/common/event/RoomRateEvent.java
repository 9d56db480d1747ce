package com.innstay.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Published by the property service whenever a room's nightly rate changes.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RoomRateEvent extends DomainEvent {

    public static final String TYPE_UPDATED = "ROOM_RATE_UPDATED";

    private Long roomId;
    private String roomName;
    private BigDecimal nightlyRate;
    private String currency;
    private boolean active;

    private RoomRateEvent(Long roomId, String roomName, BigDecimal nightlyRate,
                          String currency, boolean active) {
        super(TYPE_UPDATED);
        this.roomId = roomId;
        this.roomName = roomName;
        this.nightlyRate = nightlyRate;
        this.currency = currency;
        this.active = active;
    }

    public static RoomRateEvent updated(Long roomId, String roomName, BigDecimal nightlyRate,
                                        String currency, boolean active) {
        return new RoomRateEvent(roomId, roomName, nightlyRate, currency, active);
    }
}
