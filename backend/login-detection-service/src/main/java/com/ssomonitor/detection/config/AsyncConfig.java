package com.ssomonitor.detection.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Runs one task per thread: analysis supervision and delivery, off the Kafka consumer thread.
     * No queue: the listener is paused before the pool is exhausted, and a rejection surfaces to the
     * listener so the record is redelivered.
     */
    @Bean(name = "taskWorkerExecutor")
    public ThreadPoolTaskExecutor taskWorkerExecutor(WorkerProperties properties) {
        int poolSize = Math.max(properties.getConsumer().getWorkerPoolSize(), properties.getConsumer().getMaxInFlight());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("task-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
