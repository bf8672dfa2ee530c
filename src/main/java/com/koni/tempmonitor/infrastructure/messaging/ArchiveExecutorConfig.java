package com.koni.tempmonitor.infrastructure.messaging;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that performs archive sends off the ingestion threads.
 * A single worker keeps the hand-off order of readings; when the queue is full
 * further readings are rejected and counted as archive failures.
 */
@Configuration
public class ArchiveExecutorConfig {

    @Value("${monitor.archive.queue-capacity:1000}")
    private int queueCapacity;

    @Bean(name = "archiveExecutor")
    public ThreadPoolTaskExecutor archiveExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("archive-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
