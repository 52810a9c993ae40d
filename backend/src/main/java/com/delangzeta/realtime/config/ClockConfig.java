package com.delangzeta.realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Single time source for rate-limit windows, sync timestamps and observedAt. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
