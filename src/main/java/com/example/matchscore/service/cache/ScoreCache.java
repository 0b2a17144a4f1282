package com.example.matchscore.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.benmanes.caffeine.cache.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Read-through cache with one in-flight computation per key. The in-process Caffeine
 * tier is authoritative; the Redis tier, when present, is consulted on a local miss
 * and written after a computation.
 */
@Service
public class ScoreCache {

    private static final Logger log = LoggerFactory.getLogger(ScoreCache.class);

    private final Cache<String, CachedValue> local;
    private final RedisCacheService level2;
    private final Clock clock;
    private final Map<String, Flight> inFlight = new ConcurrentHashMap<>();

    public ScoreCache(Cache<String, CachedValue> scoreCacheStore,
                      ObjectProvider<RedisCacheService> level2,
                      Clock clock) {
        this.local = scoreCacheStore;
        this.level2 = level2.getIfAvailable();
        this.clock = clock;
    }

    /** In-process only; use the typed overload for values that may live in Redis. */
    public <T> Mono<T> getOrCompute(String key, Duration ttl, Supplier<Mono<T>> compute) {
        return getOrCompute(key, ttl, null, compute);
    }

    public <T> Mono<T> getOrCompute(String key, Duration ttl, TypeReference<T> type, Supplier<Mono<T>> compute) {
        return getOrCompute(key, ttl, type, v -> true, compute);
    }

    /**
     * Values rejected by {@code storeIf} are delivered to every caller of the flight but
     * written to neither tier, so the next request computes again.
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> getOrCompute(String key, Duration ttl, TypeReference<T> type,
                                    Predicate<? super T> storeIf, Supplier<Mono<T>> compute) {
        return Mono.defer(() -> {
            CachedValue hit = local.getIfPresent(key);
            if (hit != null) {
                log.debug("cache hit {}", key);
                return Mono.just((T) hit.getValue());
            }
            return (Mono<T>) join(key, ttl, type, storeIf, compute);
        });
    }

    private <T> Mono<Object> join(String key, Duration ttl, TypeReference<T> type,
                                  Predicate<? super T> storeIf, Supplier<Mono<T>> compute) {
        Flight existing = inFlight.get(key);
        if (existing != null) return existing.result;

        Flight flight = new Flight();
        // Flights store before they leave, so one that landed since the caller's miss is visible once this one starts.
        flight.result = Mono.defer(() -> {
                    CachedValue landed = local.getIfPresent(key);
                    if (landed != null) return Mono.just(landed.getValue());
                    return readThrough(key, ttl, type, storeIf, compute, flight)
                            .doOnNext(v -> {
                                if (!flight.stale && storeIf.test(v)) local.put(key, new CachedValue(v, ttl, clock.instant()));
                            })
                            .map(v -> (Object) v);
                })
                .doFinally(sig -> inFlight.remove(key, flight))
                .cache();

        Flight winner = inFlight.putIfAbsent(key, flight);
        return winner != null ? winner.result : flight.result;
    }

    private <T> Mono<T> readThrough(String key, Duration ttl, TypeReference<T> type,
                                    Predicate<? super T> storeIf, Supplier<Mono<T>> compute, Flight flight) {
        boolean tiered = level2 != null && type != null;
        Mono<T> computed = Mono.defer(compute)
                .flatMap(v -> {
                    if (flight.stale) {
                        log.debug("cache {} invalidated while computing; result not stored", key);
                        return Mono.just(v);
                    }
                    return tiered && storeIf.test(v) ? level2.set(key, v, ttl).thenReturn(v) : Mono.just(v);
                });
        if (!tiered) return computed;
        return level2.get(key, type)
                .doOnNext(v -> log.debug("level-2 hit {}", key))
                .switchIfEmpty(computed);
    }

    /**
     * Removes every entry whose key matches {@code pattern}: a {@code *} glob, or a plain
     * prefix when it contains no wildcard. Returns the number of local entries removed.
     */
    public Mono<Integer> invalidate(String pattern) {
        Predicate<String> matcher = matcher(pattern);
        List<String> doomed = new ArrayList<>();
        for (String k : local.asMap().keySet()) {
            if (matcher.test(k)) doomed.add(k);
        }
        local.invalidateAll(doomed);
        inFlight.entrySet().removeIf(e -> {
            if (!matcher.test(e.getKey())) return false;
            e.getValue().stale = true;
            return true;
        });
        log.info("cache invalidate {} removed {} local entries", pattern, doomed.size());

        if (level2 == null) return Mono.just(doomed.size());
        String glob = pattern.contains("*") ? pattern : pattern + "*";
        return level2.deleteMatching(glob).thenReturn(doomed.size());
    }

    public Mono<Boolean> invalidateKey(String key) {
        boolean present = local.asMap().remove(key) != null;
        Flight flight = inFlight.remove(key);
        if (flight != null) flight.stale = true;
        if (level2 == null) return Mono.just(present);
        return level2.delete(key).map(n -> present || n > 0);
    }

    public long size() {
        local.cleanUp();
        return local.estimatedSize();
    }

    /** Shared computation for one key; an invalidation while it runs marks it stale so its result is not stored. */
    private static final class Flight {
        volatile Mono<Object> result;
        volatile boolean stale;
    }

    static Predicate<String> matcher(String pattern) {
        if (!pattern.contains("*")) return k -> k.startsWith(pattern);
        String[] parts = pattern.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) regex.append(".*");
            if (!parts[i].isEmpty()) regex.append(Pattern.quote(parts[i]));
        }
        Pattern p = Pattern.compile(regex.toString());
        return k -> p.matcher(k).matches();
    }
}
