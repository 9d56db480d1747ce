package com.innstay.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "payment.gateway")
public class PaymentGatewayProperties {

    /** mock or paymongo */
    private String provider = "mock";
    private String baseUrl = "https://api.paymongo.com/v1";
    private String secretKey = "";
    private String webhookSecret = "";
    private Duration signatureTolerance = Duration.ofMinutes(5);
    private String successUrl = "http://localhost:3000/booking/confirmation";
    private String cancelUrl = "http://localhost:3000/booking/checkout";
    private List<String> paymentMethodTypes = List.of("card", "gcash", "paymaya");
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(10);

    /** A PENDING session younger than this is handed out again instead of creating a new one. */
    private Duration sessionReuseWindow = Duration.ofMinutes(30);

    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Reconciliation {
        /** PENDING payments older than this are polled at the provider. */
        private Duration settleAfter = Duration.ofMinutes(10);
        /** PENDING payments older than this with no provider outcome are expired. */
        private Duration abandonAfter = Duration.ofHours(24);
        private int batchSize = 50;
        private long intervalMs = 300_000;
    }
}
