package com.example.matchscore.repo;

import com.example.matchscore.model.Opportunity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;

public interface OpportunityRepository extends ReactiveCrudRepository<Opportunity, String> {
}
