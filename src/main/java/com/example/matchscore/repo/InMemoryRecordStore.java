package com.example.matchscore.repo;

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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Process-local store for development and tests. Instances share nothing. */
@Component
@ConditionalOnProperty(name = "matchscore.store", havingValue = "memory")
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();
    private final Map<String, Opportunity> opportunities = new ConcurrentHashMap<>();
    private final List<MatchScore> scores = new CopyOnWriteArrayList<>();
    private final List<FeedbackRecord> feedback = new CopyOnWriteArrayList<>();

    public InMemoryRecordStore putProfile(Profile profile) {
        if (profile.getId() == null) profile.setId(UUID.randomUUID().toString());
        profiles.put(profile.getId(), profile);
        return this;
    }

    public InMemoryRecordStore putOpportunity(Opportunity opportunity) {
        if (opportunity.getId() == null) opportunity.setId(UUID.randomUUID().toString());
        opportunities.put(opportunity.getId(), opportunity);
        return this;
    }

    @Override
    public Mono<Profile> getProfile(String orgId, String profileId) {
        return Mono.justOrEmpty(profiles.get(profileId))
                .filter(p -> Objects.equals(p.getOrganizationId(), orgId));
    }

    @Override
    public Mono<Opportunity> getOpportunity(String opportunityId) {
        return Mono.justOrEmpty(opportunities.get(opportunityId));
    }

    @Override
    public Mono<MatchScore> saveScore(MatchScore score) {
        return Mono.fromSupplier(() -> {
            score.setId(UUID.randomUUID().toString());
            scores.add(score);
            return score;
        });
    }

    @Override
    public Mono<MatchScore> getScore(String orgId, String scoreId) {
        return Flux.fromIterable(scores)
                .filter(s -> s.getId().equals(scoreId) && Objects.equals(s.getOrganizationId(), orgId))
                .next();
    }

    @Override
    public Flux<MatchScore> getRecentScores(String orgId, Instant since) {
        return Flux.fromIterable(scores)
                .filter(s -> Objects.equals(s.getOrganizationId(), orgId) && s.getCreatedAt().isAfter(since))
                .sort(Comparator.comparing(MatchScore::getCreatedAt).reversed());
    }

    @Override
    public Flux<MatchScore> getScoreHistory(String orgId, String profileId, String opportunityId) {
        return Flux.fromIterable(scores)
                .filter(s -> Objects.equals(s.getOrganizationId(), orgId)
                        && Objects.equals(s.getProfileId(), profileId)
                        && Objects.equals(s.getOpportunityId(), opportunityId))
                .sort(Comparator.comparing(MatchScore::getCreatedAt));
    }

    @Override
    public Flux<MatchScore> getScoresSince(String orgId, String profileId, Collection<String> opportunityIds, Instant since) {
        return Flux.fromIterable(scores)
                .filter(s -> Objects.equals(s.getOrganizationId(), orgId)
                        && Objects.equals(s.getProfileId(), profileId)
                        && opportunityIds.contains(s.getOpportunityId())
                        && s.getCreatedAt().isAfter(since))
                .sort(Comparator.comparing(MatchScore::getCreatedAt).reversed());
    }

    @Override
    public Mono<FeedbackRecord> saveFeedback(FeedbackRecord record) {
        return Mono.fromSupplier(() -> {
            record.setId(UUID.randomUUID().toString());
            feedback.add(record);
            return record;
        });
    }

    @Override
    public Flux<FeedbackRecord> getFeedback(String orgId, String scoreId) {
        return Flux.fromIterable(feedback)
                .filter(f -> Objects.equals(f.getOrganizationId(), orgId) && Objects.equals(f.getScoreId(), scoreId))
                .sort(Comparator.comparing(FeedbackRecord::getCreatedAt));
    }

    public int scoreCount() {
        return scores.size();
    }
}
