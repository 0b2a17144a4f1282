package com.example.matchscore.service;

import com.example.matchscore.exception.MatchScoreException;
import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.model.batch.BatchFailure;
import com.example.matchscore.model.batch.BatchResult;
import com.example.matchscore.model.request.BatchScoreRequest;
import com.example.matchscore.model.request.ScoreRequest;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.repo.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores many opportunities for one profile. Per-item errors are collected, never
 * propagated; only request validation and a missing profile fail the whole batch.
 */
@Service
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final MatchScoringService scoring;
    private final RecordStore store;
    private final ScoringAuditTrail audit;
    private final int maxBatchSize;
    private final int defaultConcurrency;
    private final int maxConcurrency;

    public BatchCoordinator(MatchScoringService scoring,
                            RecordStore store,
                            ScoringAuditTrail audit,
                            @Value("${matchscore.batch.max-size:50}") int maxBatchSize,
                            @Value("${matchscore.batch.default-concurrency:5}") int defaultConcurrency,
                            @Value("${matchscore.batch.max-concurrency:10}") int maxConcurrency) {
        this.scoring = scoring;
        this.store = store;
        this.audit = audit;
        this.maxBatchSize = maxBatchSize;
        this.defaultConcurrency = defaultConcurrency;
        this.maxConcurrency = maxConcurrency;
    }

    public Mono<BatchResult> scoreBatch(String orgId, BatchScoreRequest request) {
        return Mono.defer(() -> {
            MatchScoringService.requireText(orgId, "organization id");
            if (request == null) throw new ValidationException("request body is required");
            MatchScoringService.requireText(request.getProfileId(), "profileId");
            List<String> ids = distinctIds(request.getOpportunityIds());
            int concurrency = request.getConcurrency() == null ? defaultConcurrency : request.getConcurrency();
            if (concurrency < 1 || concurrency > maxConcurrency) {
                throw new ValidationException("concurrency must be between 1 and " + maxConcurrency);
            }
            if (request.getDeadlineMs() != null && request.getDeadlineMs() <= 0) {
                throw new ValidationException("deadlineMs must be positive");
            }
            if (request.getWeights() != null) request.getWeights().validate();

            String profileId = request.getProfileId().trim();
            return store.getProfile(orgId, profileId)
                    .switchIfEmpty(Mono.error(() -> NotFoundException.of("Profile", profileId)))
                    .flatMap(p -> run(orgId, profileId, ids, concurrency, request));
        });
    }

    private Mono<BatchResult> run(String orgId, String profileId, List<String> ids, int concurrency,
                                  BatchScoreRequest request) {
        long start = System.nanoTime();
        log.info("Batch start org={} profile={} items={} concurrency={} deadlineMs={}",
                orgId, profileId, ids.size(), concurrency, request.getDeadlineMs());

        Map<String, Object> finished = new ConcurrentHashMap<>();
        Flux<String> items = Flux.fromIterable(ids)
                .flatMap(id -> scoreOne(orgId, profileId, id, request)
                        .doOnNext(outcome -> finished.put(id, outcome))
                        .thenReturn(id), concurrency);
        if (request.getDeadlineMs() != null) {
            items = items.take(Duration.ofMillis(request.getDeadlineMs()));
        }

        return items.then(Mono.fromSupplier(() -> {
            BatchResult result = new BatchResult();
            result.setProfileId(profileId);
            result.setRequested(ids.size());
            for (String id : ids) {
                Object outcome = finished.get(id);
                if (outcome instanceof MatchScore s) {
                    result.getResults().add(s);
                } else if (outcome instanceof BatchFailure f) {
                    result.getFailures().add(f);
                } else {
                    result.setDeadlineExceeded(true);
                    result.getFailures().add(new BatchFailure(id, BatchFailure.DEADLINE_EXCEEDED,
                            "Not finished within " + request.getDeadlineMs() + " ms"));
                }
            }
            result.setDurationMs(Duration.ofNanos(System.nanoTime() - start).toMillis());
            log.info("Batch finish org={} profile={} ok={} failed={} in {} ms",
                    orgId, profileId, result.getSucceeded(), result.getFailed(), result.getDurationMs());
            audit.batchCompleted(orgId, result);
            return result;
        }));
    }

    private Mono<Object> scoreOne(String orgId, String profileId, String opportunityId, BatchScoreRequest request) {
        ScoreRequest item = new ScoreRequest();
        item.setProfileId(profileId);
        item.setOpportunityId(opportunityId);
        item.setMethod(request.getMethod());
        item.setWeights(request.getWeights());
        return scoring.score(orgId, item)
                .map(s -> (Object) s)
                .switchIfEmpty(Mono.fromSupplier(() -> new BatchFailure(opportunityId, "EMPTY", "No score produced")))
                .onErrorResume(e -> {
                    log.warn("Batch item {} failed: {}", opportunityId, e.toString());
                    return Mono.just(failure(opportunityId, e));
                });
    }

    static BatchFailure failure(String opportunityId, Throwable e) {
        String type = e instanceof MatchScoreException m ? m.errorType() : e.getClass().getSimpleName();
        return new BatchFailure(opportunityId, type, e.getMessage());
    }

    private List<String> distinctIds(List<String> raw) {
        if (raw == null || raw.isEmpty()) throw new ValidationException("opportunityIds must not be empty");
        if (raw.size() > maxBatchSize) {
            throw new ValidationException("At most " + maxBatchSize + " opportunities per batch (got " + raw.size() + ")");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : raw) {
            if (id == null || id.isBlank()) throw new ValidationException("opportunityIds must not contain blank ids");
            ids.add(id.trim());
        }
        return new ArrayList<>(ids);
    }
}
