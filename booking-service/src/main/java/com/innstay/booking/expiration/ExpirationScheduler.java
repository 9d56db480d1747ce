package com.innstay.booking.expiration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for the expiration sweep. The external cron endpoint runs
 * the same sweep; per-booking locks make overlapping runs safe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirationScheduler {

    private final BookingExpirationSweeper sweeper;

    @Scheduled(fixedDelayString = "${booking.expiration.sweep-interval-ms:60000}", initialDelay = 30_000)
    @SchedulerLock(name = "bookingExpirationSweep", lockAtMostFor = "PT5M", lockAtLeastFor = "PT10S")
    public void expireStaleBookings() {
        try {
            sweeper.sweep();
        } catch (Exception e) {
            log.error("Expiration sweep failed", e);
        }
    }
}
