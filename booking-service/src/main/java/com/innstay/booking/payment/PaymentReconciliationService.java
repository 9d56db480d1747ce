package com.innstay.booking.payment;

import com.innstay.booking.config.PaymentGatewayProperties;
import com.innstay.booking.domain.Payment;
import com.innstay.booking.domain.PaymentStatus;
import com.innstay.booking.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Polls the provider for payments still PENDING after the webhook should have
 * arrived. Payments nobody completed within the abandon window are expired.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationService {

    private final PaymentRepository paymentRepository;
    private final PaymentGatewayClient paymentGatewayClient;
    private final PaymentSettlementService settlementService;
    private final PaymentGatewayProperties properties;
    private final Clock clock;

    public int reconcile() {
        PaymentGatewayProperties.Reconciliation config = properties.getReconciliation();
        LocalDateTime now = LocalDateTime.now(clock);
        List<Payment> stale = paymentRepository.findByStatusAndCreatedAtBefore(
                PaymentStatus.PENDING, now.minus(config.getSettleAfter()),
                PageRequest.of(0, config.getBatchSize()));
        if (stale.isEmpty()) {
            return 0;
        }

        log.info("Reconciling {} pending payments", stale.size());
        LocalDateTime abandonBefore = now.minus(config.getAbandonAfter());
        int resolved = 0;
        for (Payment payment : stale) {
            try {
                if (reconcileOne(payment, abandonBefore)) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("Failed to reconcile payment: paymentId={}, sessionId={}",
                        payment.getId(), payment.getExternalId(), e);
            }
        }
        return resolved;
    }

    private boolean reconcileOne(Payment payment, LocalDateTime abandonBefore) {
        PaymentGatewayClient.SessionStatus status = paymentGatewayClient.fetchSessionStatus(payment.getExternalId());
        SettlementCommand command = SettlementCommand.fromStatus(status);
        if (status.outcome() == PaymentGatewayClient.SessionOutcome.PENDING) {
            if (!payment.getCreatedAt().isBefore(abandonBefore)) {
                return false;
            }
            log.info("Abandoning pending payment: paymentId={}, createdAt={}", payment.getId(), payment.getCreatedAt());
            command = new SettlementCommand(null, payment.getExternalId(),
                    PaymentGatewayClient.SessionOutcome.EXPIRED, null, BigDecimal.ZERO, "Abandoned checkout");
        }
        SettlementOutcome outcome = settlementService.settle(command);
        return outcome == SettlementOutcome.APPLIED || outcome == SettlementOutcome.LATE_PAYMENT;
    }
}
