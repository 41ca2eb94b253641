package com.catalog.picklist.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Bean("mismatchFlushExecutor")
    public TaskExecutor mismatchFlushExecutor(
            @Value("${app.mismatch.flush-executor.pool-size:2}") int poolSize,
            @Value("${app.mismatch.flush-executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(Math.max(1, poolSize));
        // A discarded dispatch is picked up by the next scheduled flush.
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.DiscardPolicy());
        executor.setThreadNamePrefix("MismatchFlush-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
