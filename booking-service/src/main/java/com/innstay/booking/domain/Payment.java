package com.innstay.booking.domain;

import com.innstay.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One attempt to collect money through the payment provider. Only the
 * provider's callback or a reconciliation poll may move it out of PENDING.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "booking_id", nullable = false)
    private Booking booking;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 20)
    private String provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false, unique = true, length = 100)
    private String externalId;

    @Column(length = 500)
    private String checkoutUrl;

    @Column(length = 100)
    private String providerReference;

    @Column(length = 255)
    private String failureReason;

    private LocalDateTime settledAt;

    @Builder
    private Payment(Booking booking, BigDecimal amount, String currency, String provider,
                    String externalId, String checkoutUrl) {
        this.booking = booking;
        this.amount = amount;
        this.currency = currency;
        this.provider = provider;
        this.externalId = externalId;
        this.checkoutUrl = checkoutUrl;
        this.status = PaymentStatus.PENDING;
    }

    public boolean isPending() {
        return this.status == PaymentStatus.PENDING;
    }

    public void markPaid(String providerReference, LocalDateTime settledAt) {
        requirePending("mark paid");
        this.status = PaymentStatus.PAID;
        this.providerReference = providerReference;
        this.settledAt = settledAt;
    }

    public void markFailed(String reason, LocalDateTime settledAt) {
        requirePending("mark failed");
        this.status = PaymentStatus.FAILED;
        this.failureReason = reason;
        this.settledAt = settledAt;
    }

    public void markExpired(LocalDateTime settledAt) {
        requirePending("expire");
        this.status = PaymentStatus.EXPIRED;
        this.settledAt = settledAt;
    }

    public void markRefunded() {
        if (this.status != PaymentStatus.PAID) {
            throw new IllegalStateException(
                    "Cannot refund payment: current status=" + this.status);
        }
        this.status = PaymentStatus.REFUNDED;
    }

    private void requirePending(String operation) {
        if (this.status != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                    "Cannot " + operation + " payment: current status=" + this.status);
        }
    }
}
