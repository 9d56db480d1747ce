package com.innstay.booking.event;

import com.innstay.booking.config.BookingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Remembers which Kafka events and webhook deliveries were already handled.
 * Concurrent deliveries of the same id race on the primary key; the loser's
 * insert is dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final ProcessedEventRepository processedEventRepository;
    private final BookingProperties properties;
    private final Clock clock;

    public boolean isDuplicate(String eventId) {
        return eventId != null && processedEventRepository.existsById(eventId);
    }

    /**
     * Records the id in the caller's transaction. Ids without a value are not
     * tracked, so such deliveries are always processed.
     */
    public void markProcessed(String eventId, String source) {
        if (eventId == null) {
            return;
        }
        try {
            processedEventRepository.save(new ProcessedEvent(eventId, source, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Event already recorded by a concurrent delivery: eventId={}, source={}", eventId, source);
        }
    }

    @Scheduled(cron = "${booking.idempotency.cleanup-cron:0 15 4 * * *}")
    @SchedulerLock(name = "processedEventCleanup", lockAtMostFor = "PT10M")
    @Transactional
    public int purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getIdempotency().getRetention());
        int deleted = processedEventRepository.deleteProcessedBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} processed event markers older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
