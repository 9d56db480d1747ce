package com.innstay.booking.repository;

import com.innstay.booking.domain.Payment;
import com.innstay.booking.domain.PaymentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByExternalId(String externalId);

    @Query("SELECT p.booking.id FROM Payment p WHERE p.externalId = :externalId")
    Optional<Long> findBookingIdByExternalId(@Param("externalId") String externalId);

    List<Payment> findByStatusAndCreatedAtBefore(PaymentStatus status, LocalDateTime before, Pageable pageable);

    Optional<Payment> findFirstByBookingIdAndStatusAndCreatedAtAfterOrderByCreatedAtDesc(
            Long bookingId, PaymentStatus status, LocalDateTime after);
}
