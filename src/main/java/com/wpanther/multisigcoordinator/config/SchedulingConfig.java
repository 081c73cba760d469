package com.wpanther.multisigcoordinator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool for the background proposal sweeps
 */
@Configuration
public class SchedulingConfig {

    @Value("${app.scheduler.pool-size:2}")
    private int poolSize;

    @Value("${app.scheduler.thread-name-prefix:proposal-sweep-}")
    private String threadNamePrefix;

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix(threadNamePrefix);
        // Let an in-flight sweep finish its transaction on shutdown
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }
}
