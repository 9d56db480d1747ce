package com.innstay.booking.ratelimit;

import com.innstay.booking.config.BookingProperties;

public enum RateLimitPolicy {
    CHECKOUT("checkout"),
    LOOKUP("lookup");

    private final String keyPrefix;

    RateLimitPolicy(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    BookingProperties.Limit limitFrom(BookingProperties.RateLimit rateLimit) {
        return switch (this) {
            case CHECKOUT -> rateLimit.getCheckout();
            case LOOKUP -> rateLimit.getLookup();
        };
    }
}
