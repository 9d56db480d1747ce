package com.innstay.booking.event.outbox;

import com.innstay.booking.config.BookingProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

/**
 * Sends one outbox row to Kafka and records the outcome on the row.
 * At-least-once: a commit failure after the send means the row goes out
 * again, so consumers deduplicate on the event id inside the payload.
 */
@Slf4j
@Service
public class OutboxEventPublisher {

    static final String HEADER_EVENT_TYPE = "eventType";
    static final String HEADER_AGGREGATE_TYPE = "aggregateType";
    private static final int SEND_TIMEOUT_SECONDS = 5;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final BookingProperties properties;
    private final Clock clock;

    public OutboxEventPublisher(
            OutboxEventRepository outboxEventRepository,
            @Qualifier("outboxKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate,
            BookingProperties properties,
            Clock clock) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public boolean publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(event.getTopic(), event.getPartitionKey(), event.getPayload());
        record.headers().add(HEADER_EVENT_TYPE, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(HEADER_AGGREGATE_TYPE, event.getAggregateType().getBytes(StandardCharsets.UTF_8));
        try {
            kafkaTemplate.send(record).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            event.markPublished(LocalDateTime.now(clock));
            outboxEventRepository.save(event);
            log.debug("Outbox event published: id={}, type={}, topic={}",
                    event.getId(), event.getEventType(), event.getTopic());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlePublishFailure(event, e);
        } catch (Exception e) {
            handlePublishFailure(event, e);
        }
        return false;
    }

    private void handlePublishFailure(OutboxEvent event, Exception e) {
        BookingProperties.Outbox config = properties.getOutbox();
        String error = e.getClass().getSimpleName() + ": " + e.getMessage();
        if (event.getRetryCount() >= config.getMaxRetries()) {
            event.markFailed(error);
            outboxEventRepository.save(event);
            log.error("Outbox event parked after {} retries: id={}, type={}, aggregateId={}",
                    event.getRetryCount(), event.getId(), event.getEventType(), event.getAggregateId(), e);
        } else {
            event.markRetrying(LocalDateTime.now(clock), config.getMaxBackoff(), error);
            outboxEventRepository.save(event);
            log.warn("Outbox event publish failed, retry {} at {}: id={}, type={}",
                    event.getRetryCount(), event.getNextAttemptAt(), event.getId(), event.getEventType(), e);
        }
    }
}
