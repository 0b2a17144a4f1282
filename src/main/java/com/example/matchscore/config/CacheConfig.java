package com.example.matchscore.config;

import com.example.matchscore.service.cache.CachedValue;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /** In-process tier of the score cache; every entry carries its own TTL. */
    @Bean
    public Cache<String, CachedValue> scoreCacheStore(@Value("${matchscore.cache.maximum-size:10000}") long maximumSize) {
        return newStore(maximumSize, Ticker.systemTicker());
    }

    public static Cache<String, CachedValue> newStore(long maximumSize, Ticker ticker) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<String, CachedValue>() {
                    @Override
                    public long expireAfterCreate(String key, CachedValue value, long currentTime) {
                        return value.getTtl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
                        return value.getTtl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }
}
