package com.delangzeta.realtime.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for housekeeping jobs (rate-limit counter cleanup). A failing run is logged and
 * the next one still fires.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String HOUSEKEEPING_SCHEDULER = "housekeeping-scheduler";

    @Bean(name = HOUSEKEEPING_SCHEDULER)
    public ThreadPoolTaskScheduler housekeepingScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("housekeeping-");
        scheduler.setErrorHandler(t -> log.error("Scheduled housekeeping run failed", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
