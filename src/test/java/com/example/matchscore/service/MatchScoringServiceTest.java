package com.example.matchscore.service;

import com.example.matchscore.Fixtures;
import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.exception.ProviderException;
import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.http.LlmCompletion;
import com.example.matchscore.http.LlmRequest;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.request.BulkCheckRequest;
import com.example.matchscore.model.request.ScoreRequest;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.model.score.ScoringWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MatchScoringServiceTest {

    private TestServices t;

    @BeforeEach
    void setUp() {
        t = new TestServices();
    }

    private static ScoreRequest request(String opportunityId) {
        ScoreRequest r = new ScoreRequest();
        r.setProfileId("prof-1");
        r.setOpportunityId(opportunityId);
        return r;
    }

    @Test
    void repeatedRequestIsServedFromCache() {
        MatchScore first = t.scoring.score(Fixtures.ORG, request("opp-1")).block();
        MatchScore second = t.scoring.score(Fixtures.ORG, request("opp-1")).block();

        assertThat(first.getId()).isNotNull();
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getOrganizationId()).isEqualTo(Fixtures.ORG);
        assertThat(t.store.scoreCount()).isEqualTo(1);
        verify(t.audit, times(1)).scoreCreated(any());
    }

    @Test
    void forceRefreshRecomputes() {
        MatchScore first = t.scoring.score(Fixtures.ORG, request("opp-1")).block();
        ScoreRequest refresh = request("opp-1");
        refresh.setForceRefresh(true);
        MatchScore second = t.scoring.score(Fixtures.ORG, refresh).block();

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(second.getOverallScore()).isEqualTo(first.getOverallScore());
        assertThat(t.store.scoreCount()).isEqualTo(2);
    }

    @Test
    void customWeightsBypassCache() {
        ScoreRequest custom = request("opp-1");
        custom.setWeights(new ScoringWeights(10, 10, 10, 70));
        t.scoring.score(Fixtures.ORG, custom).block();
        MatchScore again = t.scoring.score(Fixtures.ORG, custom).block();

        assertThat(t.store.scoreCount()).isEqualTo(2);
        assertThat(again.getCredibility().getWeight()).isEqualTo(70);
    }

    @Test
    void enrichmentWithoutProviderDegrades() {
        ScoreRequest hybrid = request("opp-1");
        hybrid.setMethod(ScoringMethod.HYBRID);

        StepVerifier.create(t.scoring.score(Fixtures.ORG, hybrid))
                .assertNext(m -> {
                    assertThat(m.isDegraded()).isTrue();
                    assertThat(m.getScoringMethod()).isEqualTo(ScoringMethod.CALCULATION);
                    assertThat(m.getOverallScore()).isEqualTo(m.getDeterministicScore());
                })
                .verifyComplete();
    }

    @Test
    void degradedEnrichmentIsNotCached() {
        when(t.provider.isEnabled()).thenReturn(true);
        when(t.provider.complete(any(LlmRequest.class)))
                .thenReturn(Mono.error(new ProviderException("OpenRouter returned 503")))
                .thenReturn(Mono.just(new LlmCompletion(
                        "{\"semanticAnalysis\": {\"implicitRequirements\": [\"FedRAMP\"]}, \"suggestedScore\": 70}",
                        "test-model", 900, 200, 0.01)));
        ScoreRequest llm = request("opp-1");
        llm.setMethod(ScoringMethod.LLM);

        MatchScore first = t.scoring.score(Fixtures.ORG, llm).block();
        MatchScore second = t.scoring.score(Fixtures.ORG, llm).block();
        MatchScore third = t.scoring.score(Fixtures.ORG, llm).block();

        assertThat(first.isDegraded()).isTrue();
        assertThat(second.isDegraded()).isFalse();
        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(second.getScoringMethod()).isEqualTo(ScoringMethod.LLM);
        assertThat(third.getId()).isEqualTo(second.getId());
        verify(t.provider, times(2)).complete(any(LlmRequest.class));
    }

    @Test
    void missingRecordsAreNotFound() {
        StepVerifier.create(t.scoring.score(Fixtures.ORG, request("opp-missing")))
                .expectError(NotFoundException.class)
                .verify();

        ScoreRequest r = request("opp-1");
        r.setProfileId("prof-missing");
        StepVerifier.create(t.scoring.score(Fixtures.ORG, r))
                .expectErrorMessage("Profile not found: prof-missing")
                .verify();
    }

    @Test
    void profilesOfOtherOrganizationsAreInvisible() {
        Profile foreign = Fixtures.profile();
        foreign.setId("prof-foreign");
        foreign.setOrganizationId("org-2");
        t.store.putProfile(foreign);

        ScoreRequest r = request("opp-1");
        r.setProfileId("prof-foreign");
        StepVerifier.create(t.scoring.score(Fixtures.ORG, r))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void invalidRequestsAreRejected() {
        ScoreRequest blank = request(" ");
        StepVerifier.create(t.scoring.score(Fixtures.ORG, blank))
                .expectError(ValidationException.class)
                .verify();

        ScoreRequest badWeights = request("opp-1");
        badWeights.setWeights(new ScoringWeights(50, 50, 50, 50));
        StepVerifier.create(t.scoring.score(Fixtures.ORG, badWeights))
                .expectError(ValidationException.class)
                .verify();

        StepVerifier.create(t.scoring.score(" ", request("opp-1")))
                .expectError(ValidationException.class)
                .verify();
        assertThat(t.store.scoreCount()).isZero();
    }

    @Test
    void recentListingSeesNewScores() {
        t.store.putOpportunity(Fixtures.opportunity("opp-2"));
        t.scoring.score(Fixtures.ORG, request("opp-1")).block();
        assertThat(t.scoring.recent(Fixtures.ORG, 24).block()).hasSize(1);

        t.scoring.score(Fixtures.ORG, request("opp-2")).block();
        assertThat(t.scoring.recent(Fixtures.ORG, 24).block()).hasSize(2);
        assertThat(t.scoring.recent("org-2", 24).block()).isEmpty();

        StepVerifier.create(t.scoring.recent(Fixtures.ORG, 0)).expectError(ValidationException.class).verify();
        StepVerifier.create(t.scoring.recent(Fixtures.ORG, 169)).expectError(ValidationException.class).verify();
    }

    @Test
    void historyListsEveryComputationOfPair() {
        ScoreRequest refresh = request("opp-1");
        refresh.setForceRefresh(true);
        t.scoring.score(Fixtures.ORG, refresh).block();
        t.scoring.score(Fixtures.ORG, refresh).block();

        assertThat(t.scoring.history(Fixtures.ORG, "prof-1", "opp-1").block()).hasSize(2);
        assertThat(t.scoring.history(Fixtures.ORG, "prof-1", "opp-2").block()).isEmpty();
    }

    private MatchScore stored(String org, String opportunityId, String createdAt, int overall) {
        MatchScore m = new MatchScore();
        m.setOrganizationId(org);
        m.setProfileId("prof-1");
        m.setOpportunityId(opportunityId);
        m.setOverallScore(overall);
        m.setCreatedAt(Instant.parse(createdAt));
        return t.store.saveScore(m).block();
    }

    private static BulkCheckRequest bulk(String... ids) {
        BulkCheckRequest r = new BulkCheckRequest();
        r.setProfileId("prof-1");
        r.setOpportunityIds(new ArrayList<>(List.of(ids)));
        return r;
    }

    @Test
    void bulkCheckReturnsLatestStoredScoreAndMissingIds() {
        stored(Fixtures.ORG, "opp-1", "2026-03-01T09:00:00Z", 50);
        MatchScore latest = stored(Fixtures.ORG, "opp-1", "2026-03-01T11:00:00Z", 60);
        stored(Fixtures.ORG, "opp-2", "2026-02-25T11:00:00Z", 70);
        stored("org-2", "opp-3", "2026-03-01T11:00:00Z", 80);

        StepVerifier.create(t.scoring.bulkCheck(Fixtures.ORG, bulk("opp-1", "opp-2", "opp-3", " opp-1 ")))
                .assertNext(r -> {
                    assertThat(r.getTotalRequested()).isEqualTo(3);
                    assertThat(r.getExistingScores()).containsOnlyKeys("opp-1");
                    assertThat(r.getExistingScores().get("opp-1").getId()).isEqualTo(latest.getId());
                    assertThat(r.getExistingScores().get("opp-1").getOverallScore()).isEqualTo(60);
                    assertThat(r.getMissingIds()).containsExactly("opp-2", "opp-3");
                })
                .verifyComplete();

        BulkCheckRequest week = bulk("opp-2");
        week.setMaxAgeHours(168);
        StepVerifier.create(t.scoring.bulkCheck(Fixtures.ORG, week))
                .assertNext(r -> assertThat(r.getExistingScores()).containsOnlyKeys("opp-2"))
                .verifyComplete();
        assertThat(t.store.scoreCount()).isEqualTo(4);
        verify(t.audit, never()).scoreCreated(any());
    }

    @Test
    void bulkCheckValidatesRequest() {
        List<String> tooMany = new ArrayList<>();
        for (int i = 0; i < 101; i++) tooMany.add("opp-" + i);
        BulkCheckRequest oversized = bulk();
        oversized.setOpportunityIds(tooMany);

        StepVerifier.create(t.scoring.bulkCheck(Fixtures.ORG, oversized)).expectError(ValidationException.class).verify();
        StepVerifier.create(t.scoring.bulkCheck(Fixtures.ORG, bulk())).expectError(ValidationException.class).verify();
        BulkCheckRequest badWindow = bulk("opp-1");
        badWindow.setMaxAgeHours(0);
        StepVerifier.create(t.scoring.bulkCheck(Fixtures.ORG, badWindow)).expectError(ValidationException.class).verify();

        BulkCheckRequest foreign = bulk("opp-1");
        foreign.setProfileId("prof-missing");
        StepVerifier.create(t.scoring.bulkCheck(Fixtures.ORG, foreign)).expectError(NotFoundException.class).verify();
    }

    @Test
    void notificationReadinessForStoredScore() {
        MatchScore m = t.scoring.score(Fixtures.ORG, request("opp-1")).block();

        StepVerifier.create(t.scoring.notificationReadiness(Fixtures.ORG, m.getId()))
                .assertNext(r -> {
                    assertThat(r.isShouldNotify()).isTrue();
                    assertThat(r.getMatchScore()).isEqualTo(m.getOverallScore());
                    assertThat(r.getRecommendations()).isEmpty();
                })
                .verifyComplete();

        StepVerifier.create(t.scoring.getScore(Fixtures.ORG, "nope"))
                .expectError(NotFoundException.class)
                .verify();
    }
}
