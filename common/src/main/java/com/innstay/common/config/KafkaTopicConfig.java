package com.innstay.common.config;

import com.innstay.common.event.Topics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

/**
 * Auto-creates Kafka topics with their partition counts.
 * Only activates when spring.kafka.bootstrap-servers is configured.
 */
@AutoConfiguration
@ConditionalOnClass(KafkaAdmin.class)
@ConditionalOnProperty(name = "spring.kafka.bootstrap-servers")
public class KafkaTopicConfig {

    private static final short REPLICATION_FACTOR = 1;

    // -- Booking topics: keyed by booking id so one booking's events stay ordered --

    @Bean
    public NewTopic bookingCreatedTopic() {
        return buildTopic(Topics.BOOKING_CREATED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingStatusChangedTopic() {
        return buildTopic(Topics.BOOKING_STATUS_CHANGED, Topics.PARTITIONS_BOOKING);
    }

    @Bean
    public NewTopic bookingAccessRequestedTopic() {
        return buildTopic(Topics.BOOKING_ACCESS_REQUESTED, Topics.PARTITIONS_BOOKING);
    }

    // -- Payment topics --

    @Bean
    public NewTopic paymentSettledTopic() {
        return buildTopic(Topics.PAYMENT_SETTLED, Topics.PARTITIONS_PAYMENT);
    }

    @Bean
    public NewTopic paymentFailedTopic() {
        return buildTopic(Topics.PAYMENT_FAILED, Topics.PARTITIONS_PAYMENT);
    }

    @Bean
    public NewTopic paymentRefundRequiredTopic() {
        return buildTopic(Topics.PAYMENT_REFUND_REQUIRED, Topics.PARTITIONS_PAYMENT);
    }

    // -- Room topics: consumed by booking-service, so they need a DLT --

    @Bean
    public NewTopic roomRateUpdatedTopic() {
        return buildTopic(Topics.ROOM_RATE_UPDATED, Topics.PARTITIONS_ROOM);
    }

    @Bean
    public NewTopic roomRateUpdatedDlt() {
        return buildDlt(Topics.ROOM_RATE_UPDATED, Topics.PARTITIONS_ROOM);
    }

    private NewTopic buildTopic(String name, int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }

    private NewTopic buildDlt(String name, int partitions) {
        return TopicBuilder.name(Topics.dlt(name))
                .partitions(partitions)
                .replicas(REPLICATION_FACTOR)
                .build();
    }
}
