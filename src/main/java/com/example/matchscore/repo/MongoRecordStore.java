package com.example.matchscore.repo;

import com.example.matchscore.exception.PersistenceException;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.score.MatchScore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;

@Component
@ConditionalOnProperty(name = "matchscore.store", havingValue = "mongo", matchIfMissing = true)
public class MongoRecordStore implements RecordStore {

    private final ProfileRepository profiles;
    private final OpportunityRepository opportunities;
    private final MatchScoreRepository scores;
    private final FeedbackRepository feedback;

    public MongoRecordStore(ProfileRepository profiles,
                            OpportunityRepository opportunities,
                            MatchScoreRepository scores,
                            FeedbackRepository feedback) {
        this.profiles = profiles;
        this.opportunities = opportunities;
        this.scores = scores;
        this.feedback = feedback;
    }

    @Override
    public Mono<Profile> getProfile(String orgId, String profileId) {
        return profiles.findByIdAndOrganizationId(profileId, orgId);
    }

    @Override
    public Mono<Opportunity> getOpportunity(String opportunityId) {
        return opportunities.findById(opportunityId);
    }

    @Override
    public Mono<MatchScore> saveScore(MatchScore score) {
        // Always insert: a score record is never overwritten.
        score.setId(null);
        return scores.save(score)
                .onErrorMap(e -> new PersistenceException("Failed to save match score for opportunity "
                        + score.getOpportunityId(), e));
    }

    @Override
    public Mono<MatchScore> getScore(String orgId, String scoreId) {
        return scores.findByIdAndOrganizationId(scoreId, orgId);
    }

    @Override
    public Flux<MatchScore> getRecentScores(String orgId, Instant since) {
        return scores.findByOrganizationIdAndCreatedAtAfterOrderByCreatedAtDesc(orgId, since);
    }

    @Override
    public Flux<MatchScore> getScoreHistory(String orgId, String profileId, String opportunityId) {
        return scores.findByOrganizationIdAndProfileIdAndOpportunityIdOrderByCreatedAtAsc(orgId, profileId, opportunityId);
    }

    @Override
    public Flux<MatchScore> getScoresSince(String orgId, String profileId, Collection<String> opportunityIds, Instant since) {
        return scores.findByOrganizationIdAndProfileIdAndOpportunityIdInAndCreatedAtAfterOrderByCreatedAtDesc(
                orgId, profileId, opportunityIds, since);
    }

    @Override
    public Mono<FeedbackRecord> saveFeedback(FeedbackRecord record) {
        record.setId(null);
        return feedback.save(record)
                .onErrorMap(e -> new PersistenceException("Failed to save feedback for score " + record.getScoreId(), e));
    }

    @Override
    public Flux<FeedbackRecord> getFeedback(String orgId, String scoreId) {
        return feedback.findByOrganizationIdAndScoreIdOrderByCreatedAtAsc(orgId, scoreId);
    }
}
