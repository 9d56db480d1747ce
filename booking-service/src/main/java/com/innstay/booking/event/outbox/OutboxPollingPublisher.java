package com.innstay.booking.event.outbox;

import com.innstay.booking.config.BookingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Drains due outbox rows to Kafka and prunes published ones. ShedLock keeps
 * polling on a single replica.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPollingPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventPublisher outboxEventPublisher;
    private final BookingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelay = 1000)
    @SchedulerLock(name = "outboxPolling", lockAtMostFor = "30s", lockAtLeastFor = "500ms")
    @Transactional
    public int pollAndPublish() {
        List<OutboxEvent> due = outboxEventRepository.findDueEvents(
                LocalDateTime.now(clock), properties.getOutbox().getBatchSize());
        if (due.isEmpty()) {
            return 0;
        }

        int published = 0;
        for (OutboxEvent event : due) {
            if (outboxEventPublisher.publishEvent(event)) {
                published++;
            }
        }
        if (published < due.size()) {
            log.info("Outbox batch: published={}, deferred={}", published, due.size() - published);
        }
        return published;
    }

    @Scheduled(cron = "0 0 4 * * *")
    @SchedulerLock(name = "outboxCleanup", lockAtMostFor = "5m", lockAtLeastFor = "1m")
    @Transactional
    public void cleanupPublishedEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getOutbox().getRetention());
        int deleted = outboxEventRepository.deletePublishedBefore(OutboxEvent.OutboxStatus.PUBLISHED, cutoff);
        if (deleted > 0) {
            log.info("Deleted {} published outbox events older than {}", deleted, cutoff);
        }
        long parked = outboxEventRepository.countByStatus(OutboxEvent.OutboxStatus.FAILED);
        if (parked > 0) {
            log.warn("{} outbox events are parked as FAILED and need manual replay", parked);
        }
    }
}
