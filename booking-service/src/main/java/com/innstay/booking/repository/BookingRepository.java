package com.innstay.booking.repository;

import com.innstay.booking.domain.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByShortRef(String shortRef);

    boolean existsByShortRef(String shortRef);

    @EntityGraph(attributePaths = "items")
    Optional<Booking> findWithItemsById(Long id);

    /**
     * Row lock for the duration of the caller's transaction. Every state
     * transition loads the booking through this method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);
}
