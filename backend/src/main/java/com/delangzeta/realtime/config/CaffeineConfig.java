package com.delangzeta.realtime.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String SESSION_TOKEN_CACHE = "sessionTokenCache";
    public static final String USER_PROFILE_CACHE = "userProfileCache";
    /** Event ids already handled by notification fan-out (consumer-side dedup). */
    public static final String PROCESSED_EVENT_CACHE = "processedEventCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(SESSION_TOKEN_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(USER_PROFILE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(PROCESSED_EVENT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(100_000)
                .build());
        return manager;
    }
}
