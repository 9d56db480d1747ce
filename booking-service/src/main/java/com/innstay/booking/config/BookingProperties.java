package com.innstay.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    private Expiration expiration = new Expiration();
    private Pricing pricing = new Pricing();
    private Token token = new Token();
    private RateLimit rateLimit = new RateLimit();
    private Cron cron = new Cron();
    private Lock lock = new Lock();
    private Outbox outbox = new Outbox();
    private Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Expiration {
        /** Age after which an untouched PENDING/UNPAID booking is cancelled. */
        private Duration threshold = Duration.ofMinutes(30);
        private long sweepIntervalMs = 60_000;
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class Pricing {
        private BigDecimal taxRate = new BigDecimal("0.12");
        private BigDecimal serviceChargeRate = new BigDecimal("0.10");
        /** Maximum accepted drift between stored and recomputed totals, in percent. */
        private BigDecimal tolerancePercent = BigDecimal.ONE;
        private String currency = "PHP";
    }

    @Getter
    @Setter
    public static class Token {
        private Duration lifetime = Duration.ofDays(30);
        private String hashingKey = "";
        /** How long expired tokens are kept before housekeeping deletes them. */
        private Duration retention = Duration.ofDays(7);
        private String cleanupCron = "0 30 3 * * *";
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        private Limit checkout = new Limit(3, 60);
        private Limit lookup = new Limit(5, 60);
    }

    @Getter
    @Setter
    public static class Limit {
        private int maxRequests;
        private int windowSeconds;

        public Limit() {
        }

        public Limit(int maxRequests, int windowSeconds) {
            this.maxRequests = maxRequests;
            this.windowSeconds = windowSeconds;
        }
    }

    @Getter
    @Setter
    public static class Cron {
        /** Shared secret for the external sweep trigger. Blank rejects every call. */
        private String secret = "";
    }

    @Getter
    @Setter
    public static class Lock {
        private long waitMs = 3000;
        private int maxOptimisticRetries = 3;
    }

    @Getter
    @Setter
    public static class Outbox {
        private int batchSize = 50;
        /** Attempts after the first before a row is parked as FAILED. */
        private int maxRetries = 5;
        private Duration maxBackoff = Duration.ofMinutes(5);
        private Duration retention = Duration.ofDays(3);
    }

    @Getter
    @Setter
    public static class Idempotency {
        /** How long processed event ids are remembered. Must outlast provider webhook redelivery. */
        private Duration retention = Duration.ofDays(14);
        private String cleanupCron = "0 15 4 * * *";
    }
}
