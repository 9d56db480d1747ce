package com.innstay.booking.event.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.innstay.common.event.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes domain events into the outbox inside the transaction that changed
 * the aggregate. Calling it with no transaction open is a programming error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(String aggregateType, Long aggregateId, String topic, DomainEvent event) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("Outbox event " + event.getEventType() + " has no aggregate id");
        }

        OutboxEvent saved = outboxEventRepository.save(new OutboxEvent(
                aggregateType, aggregateId.toString(), event.getEventType(), topic,
                toJson(event), LocalDateTime.now(clock)));
        log.debug("Queued {} for {} #{} on {} (eventId={})",
                event.getEventType(), aggregateType, aggregateId, topic, event.getEventId());
        return saved;
    }

    private String toJson(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event.getEventType() + " for the outbox", e);
        }
    }
}
