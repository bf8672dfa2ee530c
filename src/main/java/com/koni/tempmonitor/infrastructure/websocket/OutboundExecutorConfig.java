package com.koni.tempmonitor.infrastructure.websocket;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared executor draining the outbound lanes of all WebSocket connections.
 * Each connection has at most one drain task queued at a time.
 *
 * Drain tasks are handed straight to a thread: the pool keeps {@code pool-size}
 * threads warm and grows beyond it while peers are stalled, so a drain blocked on
 * one peer never holds up the lane of another.
 */
@Configuration
public class OutboundExecutorConfig {

    @Value("${monitor.websocket.outbound.pool-size:4}")
    private int poolSize;

    @Value("${monitor.websocket.outbound.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = "outboundExecutor")
    public ThreadPoolTaskExecutor outboundExecutor() {
        return outboundExecutor(poolSize, keepAliveSeconds);
    }

    static ThreadPoolTaskExecutor outboundExecutor(int poolSize, int keepAliveSeconds) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("ws-outbound-");
        return executor;
    }
}
