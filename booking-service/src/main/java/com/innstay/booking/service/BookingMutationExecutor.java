package com.innstay.booking.service;

import com.innstay.booking.config.BookingProperties;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a booking mutation under the distributed lock, retrying the whole
 * transaction when the optimistic version check fails.
 * <p>
 * The supplier must open its own transaction (a call into a
 * {@code @Transactional} bean) so each retry starts from fresh state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingMutationExecutor {

    private final BookingLockService bookingLockService;
    private final BookingProperties properties;

    public <T> T execute(Long bookingId, Supplier<T> mutation) {
        int maxAttempts = Math.max(1, properties.getLock().getMaxOptimisticRetries());
        RLock lock = bookingLockService.acquire(bookingId);
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return mutation.get();
                } catch (OptimisticLockingFailureException e) {
                    if (attempt >= maxAttempts) {
                        log.warn("Optimistic lock retries exhausted: bookingId={}, attempts={}",
                                bookingId, attempt);
                        throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                                "Booking is being updated. Please try again.", e);
                    }
                    log.info("Optimistic lock conflict, retrying: bookingId={}, attempt={}", bookingId, attempt);
                }
            }
        } finally {
            bookingLockService.release(lock);
        }
    }
}
