package com.gocars.ridesafety.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caching configuration using Caffeine (in-process cache).
 *
 *   safetySettings    - per-rider safety settings, read on every fix and check-in.
 *   emergencySettings - per-rider emergency settings and contacts, read on every alert and incident.
 *
 * Settings are owned by another service, so entries live only a few seconds: a polling session
 * re-reads at most once per TTL instead of once per decision point.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_SAFETY_SETTINGS = "safetySettings";

    public static final String CACHE_EMERGENCY_SETTINGS = "emergencySettings";

    @Value("${ride-safety.settings.cache-ttl-seconds:30}")
    private int ttlSeconds;

    @Value("${ride-safety.settings.cache-max-size:10000}")
    private int maxSize;

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager — caches: '{}', '{}' (ttl {}s)",
                CACHE_SAFETY_SETTINGS, CACHE_EMERGENCY_SETTINGS, ttlSeconds);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_SAFETY_SETTINGS),
                buildCache(CACHE_EMERGENCY_SETTINGS)
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
