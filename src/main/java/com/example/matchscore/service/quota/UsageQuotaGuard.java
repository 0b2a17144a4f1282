package com.example.matchscore.service.quota;

import reactor.core.publisher.Mono;

import java.util.Map;

public interface UsageQuotaGuard {

    String LLM_SCORING = "llm_scoring";

    /**
     * Consumes {@code quantity} units of the organization's allowance for the current period,
     * or signals {@link com.example.matchscore.exception.LimitExceededException} without consuming.
     */
    Mono<Void> checkAndConsume(String orgId, String resourceType, int quantity);

    /** Units consumed in the current period, by resource type. */
    Mono<Map<String, Long>> usage(String orgId);
}
