package com.example.matchscore.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Level-2 tier of {@link ScoreCache}. Best effort: every failure is logged and
 * reported as a miss or a no-op.
 */
@Service
@ConditionalOnProperty(name = "matchscore.cache.redis.enabled", havingValue = "true")
public class RedisCacheService {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheService.class);

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper mapper;

    public RedisCacheService(ReactiveStringRedisTemplate redis, ObjectMapper mapper) {
        this.redis = redis;
        this.mapper = mapper;
    }

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        return redis.opsForValue().get(key)
                .flatMap(json -> Mono.fromCallable(() -> mapper.readValue(json, type)))
                .onErrorResume(e -> {
                    log.warn("Redis read failed for {}: {}", key, e.toString());
                    return Mono.empty();
                });
    }

    public Mono<Boolean> set(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> mapper.writeValueAsString(value))
                .flatMap(js -> redis.opsForValue().set(key, js, ttl))
                .onErrorResume(e -> {
                    log.warn("Redis write failed for {}: {}", key, e.toString());
                    return Mono.just(false);
                });
    }

    public Mono<Long> delete(String key) {
        return redis.delete(key)
                .onErrorResume(e -> {
                    log.warn("Redis delete failed for {}: {}", key, e.toString());
                    return Mono.just(0L);
                });
    }

    /** Deletes every key matching a Redis glob, walking the keyspace with SCAN. */
    public Mono<Long> deleteMatching(String glob) {
        ScanOptions options = ScanOptions.scanOptions().match(glob).count(500).build();
        return redis.scan(options)
                .buffer(500)
                .concatMap(keys -> redis.delete(keys.toArray(new String[0])))
                .reduce(0L, Long::sum)
                .onErrorResume(e -> {
                    log.warn("Redis pattern delete failed for {}: {}", glob, e.toString());
                    return Mono.just(0L);
                });
    }
}
