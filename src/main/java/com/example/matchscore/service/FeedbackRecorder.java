package com.example.matchscore.service;

import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.model.feedback.CalibrationSignal;
import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.feedback.Outcome;
import com.example.matchscore.model.request.FeedbackRequest;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.repo.RecordStore;
import com.example.matchscore.service.cache.CacheKeys;
import com.example.matchscore.service.cache.ScoreCache;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Append-only feedback. Recording feedback evicts the cached scores of the pair so the
 * next request recomputes; the stored score itself is never modified.
 */
@Service
public class FeedbackRecorder {

    static final int MAX_COMMENT = 2000;
    static final int WIN_THRESHOLD = 70;

    private final RecordStore store;
    private final ScoreCache cache;
    private final ScoringAuditTrail audit;
    private final Clock clock;

    public FeedbackRecorder(RecordStore store, ScoreCache cache, ScoringAuditTrail audit, Clock clock) {
        this.store = store;
        this.cache = cache;
        this.audit = audit;
        this.clock = clock;
    }

    public Mono<FeedbackRecord> recordFeedback(String orgId, String scoreId, FeedbackRequest request) {
        return Mono.defer(() -> {
            MatchScoringService.requireText(orgId, "organization id");
            MatchScoringService.requireText(scoreId, "score id");
            validate(request);
            return store.getScore(orgId, scoreId)
                    .switchIfEmpty(Mono.error(() -> NotFoundException.of("Match score", scoreId)))
                    .flatMap(score -> append(orgId, score, request));
        });
    }

    private Mono<FeedbackRecord> append(String orgId, MatchScore score, FeedbackRequest request) {
        FeedbackRecord record = new FeedbackRecord();
        record.setScoreId(score.getId());
        record.setOrganizationId(orgId);
        record.setRating(request.getRating());
        record.setComment(request.getComment() == null ? null : request.getComment().trim());
        record.setOutcome(request.getOutcome());
        if (request.getOutcome() != null) {
            record.setCalibration(calibrate(score.getOverallScore(), request.getOutcome()));
        }
        record.setCreatedAt(clock.instant());

        return store.saveFeedback(record)
                .flatMap(saved -> cache.invalidate(CacheKeys.pairPattern(orgId, score.getProfileId(), score.getOpportunityId()))
                        .then(cache.invalidate(CacheKeys.recentPrefix(orgId)))
                        .thenReturn(saved))
                .doOnNext(audit::feedbackRecorded);
    }

    public Flux<FeedbackRecord> listFeedback(String orgId, String scoreId) {
        return Mono.defer(() -> {
                    MatchScoringService.requireText(orgId, "organization id");
                    MatchScoringService.requireText(scoreId, "score id");
                    return store.getScore(orgId, scoreId)
                            .switchIfEmpty(Mono.error(() -> NotFoundException.of("Match score", scoreId)));
                })
                .flatMapMany(score -> store.getFeedback(orgId, score.getId()));
    }

    static void validate(FeedbackRequest request) {
        if (request == null || (request.getRating() == null && request.getComment() == null && request.getOutcome() == null)) {
            throw new ValidationException("Provide at least one of rating, comment or outcome");
        }
        if (request.getRating() != null && (request.getRating() < 1 || request.getRating() > 5)) {
            throw new ValidationException("rating must be between 1 and 5");
        }
        if (request.getComment() != null) {
            if (request.getComment().isBlank()) throw new ValidationException("comment must not be blank");
            if (request.getComment().length() > MAX_COMMENT) {
                throw new ValidationException("comment must be at most " + MAX_COMMENT + " characters");
            }
        }
    }

    /**
     * A prediction is correct when a win was scored at least 70 or a loss below 70.
     * Large misses lower confidence more than a plain miss.
     */
    static CalibrationSignal calibrate(int predictedScore, Outcome outcome) {
        boolean correct = (outcome == Outcome.WON && predictedScore >= WIN_THRESHOLD)
                || (outcome == Outcome.LOST && predictedScore < WIN_THRESHOLD);
        double accuracy = correct ? 0.01 : -0.01;
        double confidence = 0.0;
        String note;
        if (outcome == Outcome.WON && predictedScore < 50) {
            confidence = -0.20;
            note = "Won despite a low predicted score";
        } else if (outcome == Outcome.LOST && predictedScore > 80) {
            confidence = -0.15;
            note = "Lost despite a high predicted score";
        } else if (correct) {
            confidence = 0.05;
            note = "Prediction agreed with outcome";
        } else if (outcome == Outcome.WON || outcome == Outcome.LOST) {
            note = "Prediction disagreed with outcome";
        } else {
            note = "No award decision to compare against";
        }
        return new CalibrationSignal(predictedScore, outcome, correct, accuracy, confidence, note);
    }
}
