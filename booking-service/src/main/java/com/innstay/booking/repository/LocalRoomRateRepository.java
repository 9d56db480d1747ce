package com.innstay.booking.repository;

import com.innstay.booking.domain.LocalRoomRate;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LocalRoomRateRepository extends JpaRepository<LocalRoomRate, Long> {
}
