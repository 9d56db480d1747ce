package com.innstay.booking.service;

import com.innstay.booking.config.BookingProperties;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Redis distributed lock per booking, serializing mutations across pods
 * before the database row lock is taken. Circuit breaker protects against
 * Redis outages.
 * <p>
 * The lock is held until released, renewed by Redisson's watchdog, so it
 * cannot lapse while checkout waits on the payment provider.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLockService {

    private static final String LOCK_PREFIX = "lock:booking:";

    private final RedissonClient redissonClient;
    private final BookingProperties properties;

    @CircuitBreaker(name = "bookingLock", fallbackMethod = "acquireFallback")
    public RLock acquire(Long bookingId) {
        BookingProperties.Lock config = properties.getLock();
        RLock lock = redissonClient.getLock(LOCK_PREFIX + bookingId);
        try {
            // No explicit lease: the watchdog keeps the lock alive while a provider call is in flight.
            boolean acquired = lock.tryLock(config.getWaitMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Booking lock busy: bookingId={}", bookingId);
                throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED);
            }
            return lock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED, "Lock acquisition interrupted");
        }
    }

    @SuppressWarnings("unused")
    private RLock acquireFallback(Long bookingId, Throwable t) {
        if (t instanceof BusinessException businessException) {
            throw businessException;
        }
        log.error("Redis circuit breaker open. Booking lock unavailable: bookingId={}", bookingId, t);
        throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                "Service temporarily unavailable. Please try again shortly.");
    }

    public void release(RLock lock) {
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        } catch (Exception e) {
            log.warn("Failed to release lock: {}", lock.getName(), e);
        }
    }
}
