package com.example.matchscore.repo;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.score.MatchScore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;

/**
 * Persistence used by the scoring engine. Lookups complete empty when the record does not
 * exist or belongs to another organization; write failures signal
 * {@link com.example.matchscore.exception.PersistenceException}.
 */
public interface RecordStore {

    Mono<Profile> getProfile(String orgId, String profileId);

    Mono<Opportunity> getOpportunity(String opportunityId);

    /** Appends a new score record and returns it with its id assigned. */
    Mono<MatchScore> saveScore(MatchScore score);

    Mono<MatchScore> getScore(String orgId, String scoreId);

    /** Newest first. */
    Flux<MatchScore> getRecentScores(String orgId, Instant since);

    /** Oldest first. */
    Flux<MatchScore> getScoreHistory(String orgId, String profileId, String opportunityId);

    /** Scores of one profile for any of {@code opportunityIds} created after {@code since}, newest first. */
    Flux<MatchScore> getScoresSince(String orgId, String profileId, Collection<String> opportunityIds, Instant since);

    Mono<FeedbackRecord> saveFeedback(FeedbackRecord feedback);

    /** Oldest first. */
    Flux<FeedbackRecord> getFeedback(String orgId, String scoreId);
}
