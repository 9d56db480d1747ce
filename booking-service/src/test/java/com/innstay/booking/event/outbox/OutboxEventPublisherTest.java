package com.innstay.booking.event.outbox;

import com.innstay.booking.config.BookingProperties;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutboxEventPublisherTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 2, 1, 12, 0);

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxEventPublisher(outboxEventRepository, kafkaTemplate, new BookingProperties(),
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishEvent_sent_markedPublishedWithHeaders() {
        OutboxEvent event = event();
        given(kafkaTemplate.send(any(ProducerRecord.class)))
                .willReturn(CompletableFuture.completedFuture(mock(SendResult.class)));

        assertThat(publisher.publishEvent(event)).isTrue();

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertThat(record.key()).isEqualTo("1");
        assertThat(new String(record.headers().lastHeader(OutboxEventPublisher.HEADER_EVENT_TYPE).value(),
                StandardCharsets.UTF_8)).isEqualTo("BOOKING_CREATED");
        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PUBLISHED);
        verify(outboxEventRepository).save(event);
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishEvent_brokerDown_scheduledForRetry() {
        OutboxEvent event = event();
        given(kafkaTemplate.send(any(ProducerRecord.class)))
                .willReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThat(publisher.publishEvent(event)).isFalse();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.RETRYING);
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(2));
        assertThat(event.getLastError()).contains("broker down");
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishEvent_retriesExhausted_parkedAsFailed() {
        OutboxEvent event = event();
        for (int i = 0; i < 5; i++) {
            event.markRetrying(NOW, Duration.ofMinutes(5), "earlier");
        }
        given(kafkaTemplate.send(any(ProducerRecord.class)))
                .willReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvent(event);

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.FAILED);
    }

    private static OutboxEvent event() {
        return new OutboxEvent("Booking", "1", "BOOKING_CREATED", "innstay.booking.created", "{}", NOW);
    }
}
