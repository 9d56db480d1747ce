package com.innstay.booking.dto.response;

import java.math.BigDecimal;

public record CheckoutResponse(
        String checkoutUrl,
        String sessionId,
        Long paymentId,
        BigDecimal amount,
        String currency
) {
}
