package com.innstay.booking.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long> {

    Optional<AuditLogEntry> findTopByEntityTypeAndEntityIdOrderByIdDesc(String entityType, String entityId);

    List<AuditLogEntry> findByEntityTypeAndEntityIdOrderByIdAsc(String entityType, String entityId);
}
