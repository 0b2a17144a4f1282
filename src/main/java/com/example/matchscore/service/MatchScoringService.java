package com.example.matchscore.service;

import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.batch.BulkCheckResult;
import com.example.matchscore.model.request.BulkCheckRequest;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.model.score.NotificationReadiness;
import com.example.matchscore.model.score.ScoringWeights;
import com.example.matchscore.model.request.ScoreRequest;
import com.example.matchscore.repo.RecordStore;
import com.example.matchscore.service.cache.CacheKeys;
import com.example.matchscore.service.cache.ScoreCache;
import com.example.matchscore.service.enrichment.SemanticEnrichmentClient;
import com.example.matchscore.service.quota.UsageQuotaGuard;
import com.example.matchscore.service.scoring.DeterministicScorer;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cache check, snapshot load, deterministic score, optional enrichment, persist.
 */
@Service
public class MatchScoringService {

    private static final Logger log = LoggerFactory.getLogger(MatchScoringService.class);

    static final int MAX_RECENT_HOURS = 24 * 7;
    static final int MAX_RECENT_RESULTS = 100;
    static final int MAX_BULK_CHECK_IDS = 100;
    static final int DEFAULT_BULK_CHECK_HOURS = 24;

    private static final TypeReference<MatchScore> SCORE_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<MatchScore>> SCORE_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Long>> USAGE_TYPE = new TypeReference<>() {};

    private final RecordStore store;
    private final DeterministicScorer scorer;
    private final SemanticEnrichmentClient enrichment;
    private final ScoreCache cache;
    private final UsageQuotaGuard quota;
    private final ScoringAuditTrail audit;
    private final NotificationPolicy notificationPolicy;
    private final Clock clock;
    private final Duration scoreTtl;
    private final Duration recentTtl;
    private final Duration usageTtl;

    public MatchScoringService(RecordStore store,
                               DeterministicScorer scorer,
                               SemanticEnrichmentClient enrichment,
                               ScoreCache cache,
                               UsageQuotaGuard quota,
                               ScoringAuditTrail audit,
                               NotificationPolicy notificationPolicy,
                               Clock clock,
                               @Value("${matchscore.cache.score-ttl:1h}") Duration scoreTtl,
                               @Value("${matchscore.cache.recent-ttl:60s}") Duration recentTtl,
                               @Value("${matchscore.cache.usage-ttl:60s}") Duration usageTtl) {
        this.store = store;
        this.scorer = scorer;
        this.enrichment = enrichment;
        this.cache = cache;
        this.quota = quota;
        this.audit = audit;
        this.notificationPolicy = notificationPolicy;
        this.clock = clock;
        this.scoreTtl = scoreTtl;
        this.recentTtl = recentTtl;
        this.usageTtl = usageTtl;
    }

    public Mono<MatchScore> score(String orgId, ScoreRequest request) {
        return Mono.defer(() -> {
            requireText(orgId, "organization id");
            if (request == null) throw new ValidationException("request body is required");
            requireText(request.getProfileId(), "profileId");
            requireText(request.getOpportunityId(), "opportunityId");
            ScoringWeights weights = request.getWeights() == null ? null : request.getWeights().validate();
            ScoringMethod method = request.getMethod() == null ? ScoringMethod.CALCULATION : request.getMethod();

            String profileId = request.getProfileId().trim();
            String opportunityId = request.getOpportunityId().trim();
            // Custom weights produce a different score than the cached default-weight one.
            if (weights != null && !isDefault(weights)) {
                return compute(orgId, profileId, opportunityId, method, weights);
            }

            String key = CacheKeys.score(orgId, profileId, opportunityId, method, scorer.algorithmVersion());
            Mono<Boolean> evict = request.isForceRefresh() ? cache.invalidateKey(key) : Mono.just(false);
            // A degraded enrichment is a per-call fallback; the next request retries the provider.
            return evict.then(cache.getOrCompute(key, scoreTtl, SCORE_TYPE, s -> !s.isDegraded(),
                    () -> compute(orgId, profileId, opportunityId, method, weights)));
        });
    }

    private Mono<MatchScore> compute(String orgId, String profileId, String opportunityId,
                                     ScoringMethod method, ScoringWeights weights) {
        long start = System.nanoTime();
        Mono<Profile> profile = store.getProfile(orgId, profileId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Profile", profileId)));
        Mono<Opportunity> opportunity = store.getOpportunity(opportunityId)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Opportunity", opportunityId)));

        return Mono.zip(profile, opportunity)
                .flatMap(t -> {
                    MatchScore base = scorer.score(t.getT1(), t.getT2(), weights);
                    base.setOrganizationId(orgId);
                    return enrichment.enrich(t.getT1(), t.getT2(), base, method);
                })
                .flatMap(s -> {
                    s.setProcessingTimeMs(Duration.ofNanos(System.nanoTime() - start).toMillis());
                    return store.saveScore(s);
                })
                .flatMap(saved -> cache.invalidate(CacheKeys.recentPrefix(orgId)).thenReturn(saved))
                .doOnNext(saved -> {
                    log.debug("Scored {} / {} -> {} ({} ms, method={})", profileId, opportunityId,
                            saved.getOverallScore(), saved.getProcessingTimeMs(), saved.getScoringMethod().value());
                    audit.scoreCreated(saved);
                });
    }

    public Mono<MatchScore> getScore(String orgId, String scoreId) {
        return Mono.defer(() -> {
            requireText(orgId, "organization id");
            requireText(scoreId, "score id");
            return store.getScore(orgId, scoreId)
                    .switchIfEmpty(Mono.error(() -> NotFoundException.of("Match score", scoreId)));
        });
    }

    public Mono<List<MatchScore>> recent(String orgId, int hours) {
        return Mono.defer(() -> {
            requireText(orgId, "organization id");
            if (hours < 1 || hours > MAX_RECENT_HOURS) {
                throw new ValidationException("hours must be between 1 and " + MAX_RECENT_HOURS);
            }
            return cache.getOrCompute(CacheKeys.recent(orgId, hours), recentTtl, SCORE_LIST_TYPE,
                    () -> store.getRecentScores(orgId, clock.instant().minus(Duration.ofHours(hours)))
                            .take(MAX_RECENT_RESULTS)
                            .collectList());
        });
    }

    public Mono<List<MatchScore>> history(String orgId, String profileId, String opportunityId) {
        return Mono.defer(() -> {
            requireText(orgId, "organization id");
            requireText(profileId, "profileId");
            requireText(opportunityId, "opportunityId");
            return store.getScoreHistory(orgId, profileId, opportunityId).collectList();
        });
    }

    /**
     * Latest stored score per opportunity for one profile, so callers can skip ids that
     * were scored recently. Nothing is computed.
     */
    public Mono<BulkCheckResult> bulkCheck(String orgId, BulkCheckRequest request) {
        return Mono.defer(() -> {
            requireText(orgId, "organization id");
            if (request == null) throw new ValidationException("request body is required");
            requireText(request.getProfileId(), "profileId");
            int hours = request.getMaxAgeHours() == null ? DEFAULT_BULK_CHECK_HOURS : request.getMaxAgeHours();
            if (hours < 1 || hours > MAX_RECENT_HOURS) {
                throw new ValidationException("maxAgeHours must be between 1 and " + MAX_RECENT_HOURS);
            }
            List<String> ids = bulkCheckIds(request.getOpportunityIds());
            String profileId = request.getProfileId().trim();
            Instant since = clock.instant().minus(Duration.ofHours(hours));

            return store.getProfile(orgId, profileId)
                    .switchIfEmpty(Mono.error(() -> NotFoundException.of("Profile", profileId)))
                    .flatMap(p -> store.getScoresSince(orgId, profileId, ids, since)
                            .distinct(MatchScore::getOpportunityId)
                            .collectMap(MatchScore::getOpportunityId, s -> s, HashMap::new)
                            .map(latest -> {
                                BulkCheckResult result = new BulkCheckResult();
                                result.setProfileId(profileId);
                                result.setTotalRequested(ids.size());
                                for (String id : ids) {
                                    MatchScore s = latest.get(id);
                                    if (s != null) result.getExistingScores().put(id, s);
                                    else result.getMissingIds().add(id);
                                }
                                log.debug("Bulk check {} ids for {}: {} found", ids.size(), profileId, result.getFoundCount());
                                return result;
                            }));
        });
    }

    private static List<String> bulkCheckIds(List<String> raw) {
        if (raw == null || raw.isEmpty()) throw new ValidationException("opportunityIds must not be empty");
        if (raw.size() > MAX_BULK_CHECK_IDS) {
            throw new ValidationException("At most " + MAX_BULK_CHECK_IDS + " opportunities per check (got " + raw.size() + ")");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : raw) {
            if (id == null || id.isBlank()) throw new ValidationException("opportunityIds must not contain blank ids");
            ids.add(id.trim());
        }
        return new ArrayList<>(ids);
    }

    public Mono<NotificationReadiness> notificationReadiness(String orgId, String scoreId) {
        return getScore(orgId, scoreId).map(notificationPolicy::assess);
    }

    public Mono<Map<String, Long>> usage(String orgId) {
        return Mono.defer(() -> {
            requireText(orgId, "organization id");
            return cache.getOrCompute(CacheKeys.usage(orgId, YearMonth.now(clock)), usageTtl, USAGE_TYPE,
                    () -> quota.usage(orgId));
        });
    }

    public String algorithmVersion() {
        return scorer.algorithmVersion();
    }

    private static boolean isDefault(ScoringWeights w) {
        ScoringWeights d = ScoringWeights.defaults();
        return w.getPastPerformance() == d.getPastPerformance()
                && w.getTechnicalCapability() == d.getTechnicalCapability()
                && w.getStrategicFit() == d.getStrategicFit()
                && w.getCredibility() == d.getCredibility();
    }

    static void requireText(String value, String name) {
        if (value == null || value.isBlank()) throw new ValidationException(name + " is required");
    }
}
