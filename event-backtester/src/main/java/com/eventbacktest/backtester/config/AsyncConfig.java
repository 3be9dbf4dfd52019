package com.eventbacktest.backtester.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for suite-level parallelism and asynchronous progress delivery.
 * The bar loop itself always runs on the caller's thread.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "progressTaskExecutor")
    public ThreadPoolTaskExecutor progressTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("Progress-");
        // Progress is advisory: drop the oldest update rather than block the bar loop
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "suiteExecutorService", destroyMethod = "shutdown")
    public ExecutorService suiteExecutorService(BacktestProperties properties) {
        return Executors.newFixedThreadPool(properties.getWalkForward().getSuiteThreads(),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("WalkForwardSuite-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
