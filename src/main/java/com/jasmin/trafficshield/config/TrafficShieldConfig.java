package com.jasmin.trafficshield.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class TrafficShieldConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs store writes off the decision path. */
    @Bean(name = "storeExecutor")
    public TaskExecutor storeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("store-");
        executor.initialize();
        return executor;
    }
}
