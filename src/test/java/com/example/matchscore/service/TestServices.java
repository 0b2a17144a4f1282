package com.example.matchscore.service;

import com.example.matchscore.Fixtures;
import com.example.matchscore.config.CacheConfig;
import com.example.matchscore.http.LlmProvider;
import com.example.matchscore.repo.InMemoryRecordStore;
import com.example.matchscore.service.cache.RedisCacheService;
import com.example.matchscore.service.cache.ScoreCache;
import com.example.matchscore.service.enrichment.EnrichmentPromptBuilder;
import com.example.matchscore.service.enrichment.EnrichmentResponseParser;
import com.example.matchscore.service.enrichment.SemanticEnrichmentClient;
import com.example.matchscore.service.quota.InMemoryUsageQuotaGuard;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;

import static org.mockito.Mockito.mock;

/** Real services over an in-memory store; the language-model provider and audit trail are mocks. */
final class TestServices {

    final InMemoryRecordStore store = new InMemoryRecordStore();
    final LlmProvider provider = mock(LlmProvider.class);
    final ScoringAuditTrail audit = mock(ScoringAuditTrail.class);
    final InMemoryUsageQuotaGuard quota = new InMemoryUsageQuotaGuard(500, Fixtures.CLOCK);
    final NotificationPolicy policy = new NotificationPolicy(75, 60, 65);
    final ScoreCache cache;
    final MatchScoringService scoring;

    @SuppressWarnings("unchecked")
    TestServices() {
        ObjectMapper mapper = new ObjectMapper();
        cache = new ScoreCache(CacheConfig.newStore(1000, Ticker.systemTicker()),
                mock(ObjectProvider.class), Fixtures.CLOCK);
        SemanticEnrichmentClient enrichment = new SemanticEnrichmentClient(provider, quota,
                new EnrichmentPromptBuilder(mapper), new EnrichmentResponseParser(mapper),
                "test-model", 2500, 0.4, Duration.ofSeconds(1), 0.3, 10);
        scoring = new MatchScoringService(store, Fixtures.scorer(), enrichment, cache, quota, audit, policy,
                Fixtures.CLOCK, Duration.ofHours(1), Duration.ofSeconds(60), Duration.ofSeconds(60));
        store.putProfile(Fixtures.profile()).putOpportunity(Fixtures.opportunity());
    }

    BatchCoordinator batch() {
        return new BatchCoordinator(scoring, store, audit, 50, 5, 10);
    }

    FeedbackRecorder feedback() {
        return new FeedbackRecorder(store, cache, audit, Fixtures.CLOCK);
    }
}
