package com.koni.tempmonitor.infrastructure.messaging;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration for the reading archive.
 * Readings are keyed by deviceId, so each device's history stays ordered within
 * one partition.
 */
@Configuration
public class KafkaTopicConfig {

    @Value("${monitor.archive.kafka.topic}")
    private String topicName;

    @Value("${monitor.archive.kafka.partitions:3}")
    private int partitions;

    @Value("${monitor.archive.kafka.replication-factor:1}")
    private short replicationFactor;

    @Bean
    public NewTopic temperatureReadingsTopic() {
        return TopicBuilder.name(topicName)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }
}
