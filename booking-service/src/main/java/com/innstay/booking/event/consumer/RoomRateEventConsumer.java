package com.innstay.booking.event.consumer;

import com.innstay.booking.domain.LocalRoomRate;
import com.innstay.booking.event.IdempotencyService;
import com.innstay.booking.repository.LocalRoomRateRepository;
import com.innstay.common.event.RoomRateEvent;
import com.innstay.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Keeps the local room-rate replica in step with the property service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomRateEventConsumer {

    private final LocalRoomRateRepository localRoomRateRepository;
    private final IdempotencyService idempotencyService;
    private final Clock clock;

    @KafkaListener(topics = Topics.ROOM_RATE_UPDATED, groupId = "booking-service")
    @Transactional
    public void handleRateUpdated(RoomRateEvent event) {
        if (idempotencyService.isDuplicate(event.getEventId())) {
            log.debug("Duplicate room-rate event skipped: eventId={}", event.getEventId());
            return;
        }
        if (!event.isReadable()) {
            log.warn("Room-rate event with unsupported schema skipped: eventId={}, schemaVersion={}",
                    event.getEventId(), event.getSchemaVersion());
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalRoomRate rate = localRoomRateRepository.findById(event.getRoomId())
                .map(existing -> {
                    existing.updateFrom(event.getRoomName(), event.getNightlyRate(),
                            event.getCurrency(), event.isActive(), now);
                    return existing;
                })
                .orElseGet(() -> new LocalRoomRate(event.getRoomId(), event.getRoomName(),
                        event.getNightlyRate(), event.getCurrency(), event.isActive(), now));
        localRoomRateRepository.save(rate);

        log.info("Synced room rate: roomId={}, nightlyRate={}, active={}",
                event.getRoomId(), event.getNightlyRate(), event.isActive());

        idempotencyService.markProcessed(event.getEventId(), Topics.ROOM_RATE_UPDATED);
    }
}
