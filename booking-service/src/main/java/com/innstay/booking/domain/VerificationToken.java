package com.innstay.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Guest capability for one booking. Only the keyed hash of the token is stored.
 */
@Entity
@Table(name = "verification_tokens",
        indexes = @Index(name = "idx_verification_tokens_booking", columnList = "bookingId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VerificationToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long bookingId;

    @Column(nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(nullable = false)
    private LocalDateTime issuedAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    public VerificationToken(Long bookingId, String tokenHash,
                             LocalDateTime issuedAt, LocalDateTime expiresAt) {
        this.bookingId = bookingId;
        this.tokenHash = tokenHash;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }
}
