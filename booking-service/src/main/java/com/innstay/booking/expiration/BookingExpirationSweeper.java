package com.innstay.booking.expiration;

import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.jooq.BookingJooqRepository;
import com.innstay.booking.jooq.ExpirationCandidate;
import com.innstay.booking.lifecycle.BookingExpirationPolicy;
import com.innstay.booking.service.BookingMutationExecutor;
import com.innstay.booking.service.BookingTransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cancels PENDING/UNPAID bookings older than the expiration threshold.
 * <p>
 * Each booking is expired in its own transaction under its own lock, with the
 * eligibility re-checked after locking. A failure on one booking leaves it
 * PENDING for the next run and does not affect the others. Running the sweep
 * again over the same data expires nothing new.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingExpirationSweeper {

    private final BookingJooqRepository bookingJooqRepository;
    private final BookingExpirationPolicy expirationPolicy;
    private final BookingMutationExecutor mutationExecutor;
    private final BookingTransactionService transactionService;
    private final BookingProperties properties;
    private final Clock clock;

    public SweepResult sweep() {
        return sweep(LocalDateTime.now(clock));
    }

    public SweepResult sweep(LocalDateTime now) {
        LocalDateTime cutoff = expirationPolicy.cutoff(now);
        int batchSize = properties.getExpiration().getBatchSize();

        List<Long> expired = new ArrayList<>();
        int failed = 0;
        ExpirationCandidate cursor = null;
        while (true) {
            List<ExpirationCandidate> candidates =
                    bookingJooqRepository.findExpirationCandidates(cutoff, cursor, batchSize);
            if (candidates.isEmpty()) {
                break;
            }

            for (ExpirationCandidate candidate : candidates) {
                Long bookingId = candidate.id();
                try {
                    boolean applied = mutationExecutor.execute(bookingId,
                            () -> transactionService.expireIfEligible(bookingId, now));
                    if (applied) {
                        expired.add(bookingId);
                    }
                } catch (Exception e) {
                    failed++;
                    log.error("Failed to expire booking: bookingId={}", bookingId, e);
                }
            }

            if (candidates.size() < batchSize) {
                break;
            }
            cursor = candidates.get(candidates.size() - 1);
        }

        if (!expired.isEmpty() || failed > 0) {
            log.info("Expiration sweep finished: cutoff={}, expired={}, failed={}", cutoff, expired.size(), failed);
        }
        return new SweepResult(List.copyOf(expired), failed);
    }
}
