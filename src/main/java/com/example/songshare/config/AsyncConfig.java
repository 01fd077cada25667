package com.example.songshare.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;

/**
 * Thread pool for analytics recording. Counter and event writes run here so a
 * slow or failing store never holds up the request thread.
 */
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    public static final String ANALYTICS_EXECUTOR = "analyticsTaskExecutor";

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${app.analytics.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${app.analytics.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${app.analytics.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = ANALYTICS_EXECUTOR)
    public ThreadPoolTaskExecutor analyticsTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analytics-");
        // Saturation drops the analytics task; the request itself already succeeded.
        executor.setRejectedExecutionHandler((task, pool) ->
            log.warn("Analytics queue full ({} pending), dropping event", pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Analytics executor configured - Core: {}, Max: {}, Queue: {}",
            corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return analyticsTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Uncaught exception in async method {}.{}() with parameters {}",
            method.getDeclaringClass().getSimpleName(), method.getName(), Arrays.toString(params), ex);
    }
}
