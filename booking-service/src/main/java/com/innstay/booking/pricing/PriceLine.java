package com.innstay.booking.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PriceLine(Long roomId, BigDecimal nightlyRate, LocalDate checkIn, LocalDate checkOut) {

    public int nights() {
        return BookingPriceCalculator.nights(checkIn, checkOut);
    }

    public BigDecimal lineTotal() {
        return nightlyRate.multiply(BigDecimal.valueOf(nights()));
    }
}
