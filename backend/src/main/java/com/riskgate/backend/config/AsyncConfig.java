package com.riskgate.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /**
     * Runs per-symbol cancel calls of the emergency stop in parallel.
     */
    @Bean(name = "cancelExecutor")
    public Executor cancelExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(4, processors));
        executor.setMaxPoolSize(Math.max(16, processors * 2));
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("cancel-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
