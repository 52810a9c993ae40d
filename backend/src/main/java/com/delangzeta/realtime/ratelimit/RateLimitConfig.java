package com.delangzeta.realtime.ratelimit;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    @Bean
    public RateLimitStore rateLimitStore(RateLimitProperties properties, MongoTemplate mongoTemplate) {
        if ("memory".equalsIgnoreCase(properties.getStore())) {
            return new InMemoryRateLimitStore();
        }
        return new MongoRateLimitStore(mongoTemplate);
    }
}
