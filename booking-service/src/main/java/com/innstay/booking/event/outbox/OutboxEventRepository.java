package com.innstay.booking.event.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Rows due for an attempt, oldest first. SKIP LOCKED lets a second poller
     * that slipped past the scheduler lock take a disjoint batch.
     */
    @Query(value = """
            SELECT * FROM outbox_events
            WHERE status IN ('PENDING', 'RETRYING')
            AND next_attempt_at <= :now
            ORDER BY id ASC
            LIMIT :batchSize
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<OutboxEvent> findDueEvents(@Param("now") LocalDateTime now, @Param("batchSize") int batchSize);

    long countByStatus(OutboxEvent.OutboxStatus status);

    @Modifying
    @Query("DELETE FROM OutboxEvent e WHERE e.status = :status AND e.publishedAt < :before")
    int deletePublishedBefore(@Param("status") OutboxEvent.OutboxStatus status,
                              @Param("before") LocalDateTime before);
}
