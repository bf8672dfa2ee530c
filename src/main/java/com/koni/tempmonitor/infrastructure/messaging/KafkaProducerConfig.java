package com.koni.tempmonitor.infrastructure.messaging;

import com.koni.tempmonitor.domain.event.TelemetryRecorded;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.Map;

/**
 * Producer side of the history archive.
 *
 * Starts from the {@code spring.kafka.*} properties (bootstrap servers, acks,
 * retries) and pins what the archive relies on: string keys, JSON values without
 * type headers, idempotence, and a short {@code max.block.ms}. The last one keeps
 * a send from waiting on broker metadata for long when Kafka is down.
 */
@Configuration
@RequiredArgsConstructor
public class KafkaProducerConfig {

    private final KafkaProperties kafkaProperties;

    @Value("${monitor.archive.kafka.max-block-ms:2000}")
    private long maxBlockMs;

    @Bean
    public ProducerFactory<String, TelemetryRecorded> archiveProducerFactory() {
        Map<String, Object> props = kafkaProperties.buildProducerProperties(null);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, TelemetryRecorded> kafkaTemplate(
            ProducerFactory<String, TelemetryRecorded> archiveProducerFactory) {
        return new KafkaTemplate<>(archiveProducerFactory);
    }
}
