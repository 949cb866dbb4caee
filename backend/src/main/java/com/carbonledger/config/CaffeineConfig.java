package com.carbonledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Factor lists per activity type are read on every match, so they are cached
 * and evicted by the factor admin operations.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String EMISSION_FACTORS_BY_TYPE_CACHE = "emissionFactorsByType";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(EMISSION_FACTORS_BY_TYPE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.MINUTES)
                .maximumSize(16)
                .build());
        return manager;
    }
}
