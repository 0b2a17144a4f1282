package com.example.matchscore.service.quota;

import com.example.matchscore.exception.LimitExceededException;
import com.example.matchscore.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Monthly per-organization counters. A limit below zero means unlimited. */
@Service
public class InMemoryUsageQuotaGuard implements UsageQuotaGuard {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUsageQuotaGuard.class);

    private final Map<String, Long> limits;
    private final Clock clock;
    private final ConcurrentHashMap<String, Long> counters = new ConcurrentHashMap<>();

    public InMemoryUsageQuotaGuard(@Value("${matchscore.quota.monthly-llm-limit:500}") long monthlyLlmLimit,
                                   Clock clock) {
        this.limits = Map.of(LLM_SCORING, monthlyLlmLimit);
        this.clock = clock;
    }

    @Override
    public Mono<Void> checkAndConsume(String orgId, String resourceType, int quantity) {
        return Mono.fromRunnable(() -> {
            if (quantity <= 0) throw new ValidationException("quantity must be positive");
            long limit = limits.getOrDefault(resourceType, -1L);
            String key = key(orgId, resourceType, YearMonth.now(clock));
            // compute() makes check-then-increment atomic per key.
            counters.compute(key, (k, used) -> {
                long current = used == null ? 0L : used;
                if (limit >= 0 && current + quantity > limit) {
                    log.warn("Quota denied: org={} resource={} used={} limit={}", orgId, resourceType, current, limit);
                    throw new LimitExceededException(resourceType, limit);
                }
                return current + quantity;
            });
        });
    }

    @Override
    public Mono<Map<String, Long>> usage(String orgId) {
        return Mono.fromSupplier(() -> {
            String suffix = "|" + YearMonth.now(clock);
            String prefix = orgId + "|";
            Map<String, Long> out = new TreeMap<>();
            counters.forEach((k, v) -> {
                if (k.startsWith(prefix) && k.endsWith(suffix)) {
                    out.put(k.substring(prefix.length(), k.length() - suffix.length()), v);
                }
            });
            return out;
        });
    }

    private static String key(String orgId, String resourceType, YearMonth period) {
        return orgId + "|" + resourceType + "|" + period;
    }
}
