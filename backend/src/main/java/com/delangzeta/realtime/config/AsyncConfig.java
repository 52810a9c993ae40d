package com.delangzeta.realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. The connector pool is defined with the connectors (IngestionConfig); push sends get a
 * bounded pool here.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String CONNECTOR_EXECUTOR = "connector-executor";
    public static final String NOTIFICATION_EXECUTOR = "notification-executor";

    @Bean(name = NOTIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
