package com.innstay.booking.pricing;

import com.innstay.booking.config.BookingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Shared pricing rules for booking creation and checkout re-verification:
 * subtotal is the sum of nightly rate times nights, tax and service charge are
 * percentages of the subtotal. Money is kept at two decimals, HALF_UP.
 */
@Component
@RequiredArgsConstructor
public class BookingPriceCalculator {

    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BookingProperties properties;

    /** A stay of less than one full day still counts as one night. */
    public static int nights(LocalDate checkIn, LocalDate checkOut) {
        long days = ChronoUnit.DAYS.between(checkIn, checkOut);
        return (int) Math.max(1, days);
    }

    public PriceBreakdown calculate(List<PriceLine> lines) {
        BigDecimal subtotal = lines.stream()
                .map(PriceLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        BookingProperties.Pricing pricing = properties.getPricing();
        BigDecimal tax = money(subtotal.multiply(pricing.getTaxRate()));
        BigDecimal serviceCharge = money(subtotal.multiply(pricing.getServiceChargeRate()));
        BigDecimal total = subtotal.add(tax).add(serviceCharge);
        return new PriceBreakdown(subtotal, tax, serviceCharge, total);
    }

    /**
     * Absolute difference relative to the stored value, in percent. A zero
     * stored value is 0% off only when the recomputed value is also zero.
     */
    public BigDecimal percentageDiff(BigDecimal stored, BigDecimal calculated) {
        if (stored.signum() == 0) {
            return calculated.signum() == 0 ? BigDecimal.ZERO : HUNDRED;
        }
        return calculated.subtract(stored).abs()
                .multiply(HUNDRED)
                .divide(stored.abs(), PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public boolean isWithinTolerance(BigDecimal percentageDiff) {
        return percentageDiff.compareTo(properties.getPricing().getTolerancePercent()) <= 0;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
