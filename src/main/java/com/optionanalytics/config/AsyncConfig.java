package com.optionanalytics.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for chain analytics. Each contract's solve is an independent unit of work,
 * so the pool simply fans a chain out across cores.
 */
@Configuration
public class AsyncConfig {

    @Value("${optionanalytics.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${optionanalytics.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${optionanalytics.async.queue-capacity:10000}")
    private int queueCapacity;

    @Bean("analyticsExecutor")
    public ThreadPoolTaskExecutor analyticsExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analytics-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
