package com.innstay.booking.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentReconciliationScheduler {

    private static final String LOCK_KEY = "lock:payment-reconciliation";
    private static final long LOCK_LEASE_SECONDS = 240;

    private final PaymentReconciliationService reconciliationService;
    private final RedissonClient redissonClient;

    @Scheduled(fixedDelayString = "${payment.gateway.reconciliation.interval-ms:300000}", initialDelay = 60000)
    public void reconcilePendingPayments() {
        RLock lock = redissonClient.getLock(LOCK_KEY);
        boolean acquired = false;
        try {
            acquired = lock.tryLock(0, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
            if (!acquired) {
                log.debug("Payment reconciliation skipped: another instance holds the lock");
                return;
            }
            int resolved = reconciliationService.reconcile();
            if (resolved > 0) {
                log.info("Payment reconciliation resolved {} payments", resolved);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Payment reconciliation interrupted");
        } catch (Exception e) {
            log.error("Payment reconciliation failed", e);
        } finally {
            if (acquired && lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
