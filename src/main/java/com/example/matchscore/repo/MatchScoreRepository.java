package com.example.matchscore.repo;

import com.example.matchscore.model.score.MatchScore;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;

public interface MatchScoreRepository extends ReactiveCrudRepository<MatchScore, String> {
    Mono<MatchScore> findByIdAndOrganizationId(String id, String organizationId);

    Flux<MatchScore> findByOrganizationIdAndCreatedAtAfterOrderByCreatedAtDesc(String organizationId, Instant since);

    Flux<MatchScore> findByOrganizationIdAndProfileIdAndOpportunityIdOrderByCreatedAtAsc(
            String organizationId, String profileId, String opportunityId);

    Flux<MatchScore> findByOrganizationIdAndProfileIdAndOpportunityIdInAndCreatedAtAfterOrderByCreatedAtDesc(
            String organizationId, String profileId, Collection<String> opportunityIds, Instant since);
}
