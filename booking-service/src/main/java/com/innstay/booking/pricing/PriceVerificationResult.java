package com.innstay.booking.pricing;

import java.math.BigDecimal;

public record PriceVerificationResult(
        boolean valid,
        BigDecimal storedTotal,
        BigDecimal calculatedTotal,
        BigDecimal difference,
        BigDecimal percentageDiff,
        String reason
) {

    static final String REASON_PRICE_CHANGED = "Price has changed since booking was created";
    static final String REASON_NOT_FOUND = "Booking not found";
    static final String REASON_RATE_UNAVAILABLE = "Room rate is no longer available";

    static PriceVerificationResult notFound() {
        return new PriceVerificationResult(false, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, REASON_NOT_FOUND);
    }

    static PriceVerificationResult rateUnavailable(BigDecimal storedTotal) {
        return new PriceVerificationResult(false, storedTotal, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, REASON_RATE_UNAVAILABLE);
    }
}
