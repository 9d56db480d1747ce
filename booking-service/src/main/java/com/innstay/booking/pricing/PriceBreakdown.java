package com.innstay.booking.pricing;

import java.math.BigDecimal;

public record PriceBreakdown(BigDecimal subtotal, BigDecimal tax, BigDecimal serviceCharge, BigDecimal total) {
}
