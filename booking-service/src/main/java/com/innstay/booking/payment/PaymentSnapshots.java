package com.innstay.booking.payment;

import com.innstay.booking.audit.AuditSnapshot;
import com.innstay.booking.domain.Payment;

final class PaymentSnapshots {

    static final String ENTITY_TYPE = "Payment";

    private PaymentSnapshots() {
    }

    static AuditSnapshot of(Payment payment) {
        return AuditSnapshot.builder()
                .put("bookingId", payment.getBooking().getId())
                .put("amount", payment.getAmount())
                .put("currency", payment.getCurrency())
                .put("provider", payment.getProvider())
                .put("externalId", payment.getExternalId())
                .put("status", payment.getStatus())
                .put("providerReference", payment.getProviderReference())
                .put("failureReason", payment.getFailureReason())
                .put("settledAt", payment.getSettledAt())
                .build();
    }
}
