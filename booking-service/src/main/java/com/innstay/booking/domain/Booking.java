package com.innstay.booking.domain;

import com.innstay.common.domain.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate root for a guest reservation. Status and payment status are only
 * changed through {@link #applyTransition}, which the booking state machine
 * calls after validating the transition.
 */
@Entity
@Table(name = "bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 12)
    private String shortRef;

    private Long userId;

    @Column(nullable = false, length = 100)
    private String guestName;

    @Column(nullable = false, length = 255)
    private String guestEmail;

    @Column(length = 30)
    private String guestPhone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingPaymentStatus paymentStatus;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotalAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal taxAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal serviceCharge;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amountDue;

    @Column(nullable = false, length = 3)
    private String currency;

    @Version
    private Long version;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<BookingItem> items = new ArrayList<>();

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL)
    private List<Payment> payments = new ArrayList<>();

    @Builder
    private Booking(String shortRef, Long userId, String guestName, String guestEmail,
                    String guestPhone, String currency) {
        this.shortRef = shortRef;
        this.userId = userId;
        this.guestName = guestName;
        this.guestEmail = guestEmail;
        this.guestPhone = guestPhone;
        this.currency = currency;
        this.status = BookingStatus.PENDING;
        this.paymentStatus = BookingPaymentStatus.UNPAID;
        this.subtotalAmount = BigDecimal.ZERO;
        this.taxAmount = BigDecimal.ZERO;
        this.serviceCharge = BigDecimal.ZERO;
        this.totalAmount = BigDecimal.ZERO;
        this.amountPaid = BigDecimal.ZERO;
        this.amountDue = BigDecimal.ZERO;
    }

    public BookingItem addItem(Long roomId, LocalDate checkIn, LocalDate checkOut,
                               int nights, BigDecimal nightlyRate) {
        BookingItem item = new BookingItem(this, roomId, checkIn, checkOut, nights, nightlyRate);
        this.items.add(item);
        return item;
    }

    public void applyCharges(BigDecimal subtotalAmount, BigDecimal taxAmount,
                             BigDecimal serviceCharge, BigDecimal totalAmount) {
        this.subtotalAmount = subtotalAmount;
        this.taxAmount = taxAmount;
        this.serviceCharge = serviceCharge;
        this.totalAmount = totalAmount;
        this.amountDue = totalAmount.subtract(this.amountPaid);
    }

    public Payment addPayment(BigDecimal amount, String provider, String externalId, String checkoutUrl) {
        Payment payment = Payment.builder()
                .booking(this)
                .amount(amount)
                .currency(this.currency)
                .provider(provider)
                .externalId(externalId)
                .checkoutUrl(checkoutUrl)
                .build();
        this.payments.add(payment);
        return payment;
    }

    public Optional<Payment> findPayment(String externalId) {
        return payments.stream()
                .filter(p -> p.getExternalId().equals(externalId))
                .findFirst();
    }

    /**
     * Sum of all successfully settled payments, which may exceed the total.
     */
    public BigDecimal settledTotal() {
        return payments.stream()
                .filter(p -> p.getStatus() == PaymentStatus.PAID)
                .map(Payment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void applyTransition(BookingStatus status, BookingPaymentStatus paymentStatus,
                                BigDecimal amountPaid) {
        this.status = status;
        this.paymentStatus = paymentStatus;
        this.amountPaid = amountPaid;
        this.amountDue = this.totalAmount.subtract(amountPaid);
    }

    public void refundSettledPayments() {
        payments.stream()
                .filter(p -> p.getStatus() == PaymentStatus.PAID)
                .forEach(Payment::markRefunded);
    }

    public boolean hasPaidAmount() {
        return this.amountPaid.signum() > 0;
    }
}
