package com.innstay.booking.payment;

import com.innstay.booking.event.IdempotencyService;
import com.innstay.booking.repository.PaymentRepository;
import com.innstay.booking.service.BookingMutationExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Applies provider outcomes to payments and their bookings. Webhook
 * deliveries and reconciliation polls both end up here, so the same session
 * reported twice settles once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSettlementService {

    private final PaymentRepository paymentRepository;
    private final IdempotencyService idempotencyService;
    private final BookingMutationExecutor mutationExecutor;
    private final PaymentSettlementTransactionService transactionService;

    public SettlementOutcome settle(SettlementCommand command) {
        if (idempotencyService.isDuplicate(command.eventId())) {
            log.info("Duplicate payment event skipped: eventId={}", command.eventId());
            return SettlementOutcome.DUPLICATE;
        }

        Optional<Long> bookingId = paymentRepository.findBookingIdByExternalId(command.sessionId());
        if (bookingId.isEmpty()) {
            log.warn("No payment for provider session: sessionId={}, eventId={}",
                    command.sessionId(), command.eventId());
            return SettlementOutcome.UNKNOWN_SESSION;
        }

        SettlementOutcome outcome = mutationExecutor.execute(bookingId.get(),
                () -> transactionService.apply(bookingId.get(), command));
        log.info("Payment settlement: bookingId={}, sessionId={}, reported={}, outcome={}",
                bookingId.get(), command.sessionId(), command.outcome(), outcome);
        return outcome;
    }
}
