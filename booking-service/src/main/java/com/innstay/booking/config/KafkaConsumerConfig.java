package com.innstay.booking.config;

import com.innstay.common.event.Topics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Room-rate consumer error handling. Transient failures get three attempts
 * (1s, 2s, 4s) before the record moves to {@code <topic>.DLT}; payloads that
 * cannot be read go there at once.
 */
@Slf4j
@Configuration
public class KafkaConsumerConfig {

    static final long INITIAL_INTERVAL_MS = 1000L;
    static final double MULTIPLIER = 2.0;
    static final int MAX_ATTEMPTS = 3;

    @Bean
    public CommonErrorHandler kafkaErrorHandler(
            @Qualifier("deadLetterKafkaTemplate") KafkaTemplate<String, Object> deadLetterTemplate) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(deadLetterTemplate,
                (record, ex) -> {
                    log.error("Dead-lettering record: topic={}, partition={}, offset={}, key={}",
                            record.topic(), record.partition(), record.offset(), record.key(), ex);
                    return new TopicPartition(Topics.dlt(record.topic()), record.partition());
                });

        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL_MS, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(DeserializationException.class, IllegalArgumentException.class);
        errorHandler.setRetryListeners((ConsumerRecord<?, ?> record, Exception ex, int deliveryAttempt) ->
                log.warn("Consumer retry {}/{}: topic={}, key={}, error={}",
                        deliveryAttempt, MAX_ATTEMPTS, record.topic(), record.key(), ex.getMessage()));
        return errorHandler;
    }
}
