package com.koni.tempmonitor.infrastructure.observability;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Health indicator for the history archive hand-off.
 *
 * Reports UP when the Kafka cluster can be described and DOWN otherwise. The
 * archive circuit breaker state is included either way. Ingestion keeps working
 * while this indicator is DOWN; only archiving is affected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaArchiveHealthIndicator implements HealthIndicator {

    private final KafkaAdmin kafkaAdmin;
    private final CircuitBreaker archiveCircuitBreaker;

    @Override
    public Health health() {
        String breakerState = archiveCircuitBreaker.getState().name();

        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            DescribeClusterResult clusterResult = adminClient.describeCluster();

            String clusterId = clusterResult.clusterId().get(5, TimeUnit.SECONDS);
            int nodeCount = clusterResult.nodes().get(5, TimeUnit.SECONDS).size();

            log.debug("Kafka archive health check passed: clusterId={}, nodes={}", clusterId, nodeCount);

            return Health.up()
                    .withDetail("clusterId", clusterId)
                    .withDetail("nodeCount", nodeCount)
                    .withDetail("circuitBreaker", breakerState)
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Kafka archive health check interrupted");
            return down(e, breakerState);

        } catch (Exception e) {
            log.warn("Kafka archive health check failed: {}", e.getMessage());
            return down(e, breakerState);
        }
    }

    private static Health down(Exception cause, String breakerState) {
        return Health.down()
                .withDetail("error", cause.getClass().getSimpleName())
                .withDetail("message", String.valueOf(cause.getMessage()))
                .withDetail("circuitBreaker", breakerState)
                .build();
    }
}
