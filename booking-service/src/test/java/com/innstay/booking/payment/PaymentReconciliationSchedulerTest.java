package com.innstay.booking.payment;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentReconciliationSchedulerTest {

    @Mock
    private PaymentReconciliationService reconciliationService;
    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RLock lock;

    @InjectMocks
    private PaymentReconciliationScheduler scheduler;

    @Test
    void reconcilePendingPayments_lockAcquired_reconcilesAndUnlocks() throws InterruptedException {
        when(redissonClient.getLock("lock:payment-reconciliation")).thenReturn(lock);
        when(lock.tryLock(0, 240, TimeUnit.SECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
        when(reconciliationService.reconcile()).thenReturn(2);

        scheduler.reconcilePendingPayments();

        verify(reconciliationService).reconcile();
        verify(lock).unlock();
    }

    @Test
    void reconcilePendingPayments_lockHeldElsewhere_skips() throws InterruptedException {
        when(redissonClient.getLock("lock:payment-reconciliation")).thenReturn(lock);
        when(lock.tryLock(0, 240, TimeUnit.SECONDS)).thenReturn(false);

        scheduler.reconcilePendingPayments();

        verify(reconciliationService, never()).reconcile();
        verify(lock, never()).unlock();
    }

    @Test
    void reconcilePendingPayments_failure_unlocksAndSwallowsForNextRun() throws InterruptedException {
        when(redissonClient.getLock("lock:payment-reconciliation")).thenReturn(lock);
        when(lock.tryLock(0, 240, TimeUnit.SECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
        when(reconciliationService.reconcile()).thenThrow(new IllegalStateException("db down"));

        scheduler.reconcilePendingPayments();

        verify(lock).unlock();
    }
}
