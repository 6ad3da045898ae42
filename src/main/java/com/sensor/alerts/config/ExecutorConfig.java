package com.sensor.alerts.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for per-recipient work (block re-checks, alert writes, push
 * calls). CallerRunsPolicy keeps a burst from being rejected outright once
 * the queue is full.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "recipientExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor recipientExecutor(FanOutConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("recipient-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
