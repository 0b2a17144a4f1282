package com.example.matchscore.repo;

import com.example.matchscore.model.feedback.FeedbackRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface FeedbackRepository extends ReactiveCrudRepository<FeedbackRecord, String> {
    Flux<FeedbackRecord> findByOrganizationIdAndScoreIdOrderByCreatedAtAsc(String organizationId, String scoreId);
}
