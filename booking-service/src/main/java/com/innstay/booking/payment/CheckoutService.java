package com.innstay.booking.payment;

import com.innstay.booking.dto.request.CheckoutRequest;
import com.innstay.booking.dto.response.CheckoutResponse;
import com.innstay.booking.ratelimit.RateLimitPolicy;
import com.innstay.booking.ratelimit.RequestRateLimiter;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.service.BookingMutationExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a verified booking into a provider checkout session and a PENDING
 * payment. Nothing is marked paid here; only the provider callback or a
 * reconciliation poll settles a payment.
 * <p>
 * Runs under the booking lock, so concurrent requests for one booking either
 * reuse the same open session or wait for it to be recorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final RequestRateLimiter rateLimiter;
    private final BookingMutationExecutor mutationExecutor;
    private final CheckoutTransactionService transactionService;
    private final PaymentGatewayClient paymentGatewayClient;

    public CheckoutResponse createCheckout(CheckoutRequest request, ActorContext actor) {
        rateLimiter.checkOrThrow(RateLimitPolicy.CHECKOUT, actor.clientIp());

        Long bookingId = request.bookingId();
        log.info("Checkout requested: bookingId={}, userId={}, ip={}", bookingId, actor.userId(), actor.clientIp());

        return mutationExecutor.execute(bookingId, () -> {
            CheckoutPlan plan = transactionService.prepare(bookingId, actor, request.token());
            if (plan.isReuse()) {
                return plan.reusable();
            }
            PaymentGatewayClient.CheckoutSession session = paymentGatewayClient.createCheckoutSession(plan.request());
            return transactionService.recordPendingPayment(bookingId, plan.request(), session,
                    paymentGatewayClient.providerName(), actor);
        });
    }
}
