package com.innstay.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One room over one date range. The nightly rate is a snapshot taken when the
 * booking was created; price verification compares it against the live rate.
 */
@Entity
@Table(name = "booking_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "booking_id", nullable = false)
    private Booking booking;

    @Column(nullable = false)
    private Long roomId;

    @Column(nullable = false)
    private LocalDate checkIn;

    @Column(nullable = false)
    private LocalDate checkOut;

    @Column(nullable = false)
    private int nights;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal nightlyRate;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal lineTotal;

    BookingItem(Booking booking, Long roomId, LocalDate checkIn, LocalDate checkOut,
                int nights, BigDecimal nightlyRate) {
        this.booking = booking;
        this.roomId = roomId;
        this.checkIn = checkIn;
        this.checkOut = checkOut;
        this.nights = nights;
        this.nightlyRate = nightlyRate;
        this.lineTotal = nightlyRate.multiply(BigDecimal.valueOf(nights));
    }
}
