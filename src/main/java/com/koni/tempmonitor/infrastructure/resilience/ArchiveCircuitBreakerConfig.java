package com.koni.tempmonitor.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker in front of the history archive hand-off.
 *
 * Counts archive sends, successful or not, over the last {@code window-size}
 * readings. Once at least {@code minimum-calls} have been seen and the share of
 * failed sends reaches {@code failure-rate-threshold}, the archive is skipped
 * for {@code open-duration}; readings in that period are counted as archive
 * failures but still reach the registry and the dashboards.
 */
@Configuration
public class ArchiveCircuitBreakerConfig {

    public static final String ARCHIVE_CIRCUIT_BREAKER = "archive";

    @Value("${monitor.archive.circuit-breaker.window-size:10}")
    private int windowSize;

    @Value("${monitor.archive.circuit-breaker.minimum-calls:5}")
    private int minimumCalls;

    @Value("${monitor.archive.circuit-breaker.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${monitor.archive.circuit-breaker.open-duration:PT10S}")
    private Duration openDuration;

    @Value("${monitor.archive.circuit-breaker.half-open-calls:3}")
    private int halfOpenCalls;

    @Bean
    public CircuitBreaker archiveCircuitBreaker() {
        return archiveCircuitBreaker(windowSize, minimumCalls, failureRateThreshold, openDuration, halfOpenCalls);
    }

    static CircuitBreaker archiveCircuitBreaker(
            int windowSize, int minimumCalls, float failureRateThreshold, Duration openDuration, int halfOpenCalls) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(windowSize)
                .minimumNumberOfCalls(minimumCalls)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(openDuration)
                .permittedNumberOfCallsInHalfOpenState(halfOpenCalls)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();
        return CircuitBreaker.of(ARCHIVE_CIRCUIT_BREAKER, config);
    }
}
