package com.jonathantong.SensorRelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Execution resources for the relay
 */
@Configuration
public class RelayConfig {

    /**
     * Single fan-out thread: keeps publish order per subscriber and never blocks the binlog reader
     */
    @Bean(name = "fanOutExecutor")
    public ThreadPoolTaskExecutor fanOutExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("fan-out-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
