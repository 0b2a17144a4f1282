package com.example.matchscore.repo;

import com.example.matchscore.model.Profile;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface ProfileRepository extends ReactiveCrudRepository<Profile, String> {
    Mono<Profile> findByIdAndOrganizationId(String id, String organizationId);
}
