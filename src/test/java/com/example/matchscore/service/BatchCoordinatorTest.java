package com.example.matchscore.service;

import com.example.matchscore.Fixtures;
import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.model.batch.BatchFailure;
import com.example.matchscore.model.batch.BatchResult;
import com.example.matchscore.model.request.BatchScoreRequest;
import com.example.matchscore.model.request.ScoreRequest;
import com.example.matchscore.model.score.MatchScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchCoordinatorTest {

    private TestServices t;

    @BeforeEach
    void setUp() {
        t = new TestServices();
    }

    private static BatchScoreRequest request(List<String> ids) {
        BatchScoreRequest r = new BatchScoreRequest();
        r.setProfileId("prof-1");
        r.setOpportunityIds(ids);
        return r;
    }

    @Test
    void oneFailureDoesNotSinkTheBatch() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String id = "opp-b" + i;
            ids.add(id);
            if (i != 3) t.store.putOpportunity(Fixtures.opportunity(id));
        }

        BatchResult result = t.batch().scoreBatch(Fixtures.ORG, request(ids)).block();

        assertThat(result.getRequested()).isEqualTo(10);
        assertThat(result.getSucceeded()).isEqualTo(9);
        assertThat(result.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getOpportunityId()).isEqualTo("opp-b3");
            assertThat(f.getErrorType()).isEqualTo("NOT_FOUND");
        });
        assertThat(result.isDeadlineExceeded()).isFalse();
        assertThat(result.getResults()).extracting(MatchScore::getOpportunityId)
                .containsExactly("opp-b0", "opp-b1", "opp-b2", "opp-b4", "opp-b5", "opp-b6", "opp-b7", "opp-b8", "opp-b9");
        verify(t.audit).batchCompleted(Fixtures.ORG, result);
    }

    @Test
    void duplicateIdsAreScoredOnce() {
        BatchResult result = t.batch().scoreBatch(Fixtures.ORG, request(List.of("opp-1", "opp-1", " opp-1 "))).block();

        assertThat(result.getRequested()).isEqualTo(1);
        assertThat(result.getSucceeded()).isEqualTo(1);
        assertThat(t.store.scoreCount()).isEqualTo(1);
    }

    @Test
    void oversizedOrInvalidBatchIsRejectedBeforeAnyWork() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 51; i++) ids.add("opp-1");
        StepVerifier.create(t.batch().scoreBatch(Fixtures.ORG, request(ids)))
                .expectErrorMatches(e -> e instanceof ValidationException && e.getMessage().contains("At most 50"))
                .verify();

        StepVerifier.create(t.batch().scoreBatch(Fixtures.ORG, request(List.of())))
                .expectError(ValidationException.class)
                .verify();

        BatchScoreRequest tooParallel = request(List.of("opp-1"));
        tooParallel.setConcurrency(11);
        StepVerifier.create(t.batch().scoreBatch(Fixtures.ORG, tooParallel))
                .expectError(ValidationException.class)
                .verify();

        assertThat(t.store.scoreCount()).isZero();
    }

    @Test
    void missingProfileFailsWholeBatch() {
        BatchScoreRequest r = request(List.of("opp-1"));
        r.setProfileId("prof-missing");

        StepVerifier.create(t.batch().scoreBatch(Fixtures.ORG, r))
                .expectError(NotFoundException.class)
                .verify();
        verify(t.audit, never()).batchCompleted(anyString(), any());
    }

    @Test
    void concurrencyIsCapped() {
        MatchScoringService scoring = mock(MatchScoringService.class);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(scoring.score(eq(Fixtures.ORG), any(ScoreRequest.class))).thenAnswer(inv -> {
            ScoreRequest r = inv.getArgument(1);
            // Released before the value reaches flatMap, which then admits the next item.
            return Mono.delay(Duration.ofMillis(30))
                    .map(x -> {
                        active.decrementAndGet();
                        return scored(r.getOpportunityId());
                    })
                    .doOnSubscribe(s -> peak.accumulateAndGet(active.incrementAndGet(), Math::max));
        });
        BatchCoordinator batch = new BatchCoordinator(scoring, t.store, t.audit, 50, 5, 10);

        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 12; i++) ids.add("opp-c" + i);
        BatchScoreRequest r = request(ids);
        r.setConcurrency(3);

        BatchResult result = batch.scoreBatch(Fixtures.ORG, r).block(Duration.ofSeconds(5));

        assertThat(result.getSucceeded()).isEqualTo(12);
        assertThat(peak.get()).isLessThanOrEqualTo(3);
    }

    @Test
    void unfinishedItemsAreReportedAtDeadline() {
        MatchScoringService scoring = mock(MatchScoringService.class);
        when(scoring.score(eq(Fixtures.ORG), any(ScoreRequest.class))).thenAnswer(inv -> {
            ScoreRequest r = inv.getArgument(1);
            if (r.getOpportunityId().equals("opp-slow")) return Mono.never();
            return Mono.just(scored(r.getOpportunityId()));
        });
        BatchCoordinator batch = new BatchCoordinator(scoring, t.store, t.audit, 50, 5, 10);

        BatchScoreRequest r = request(List.of("opp-a", "opp-slow", "opp-b"));
        r.setDeadlineMs(200L);

        StepVerifier.create(batch.scoreBatch(Fixtures.ORG, r))
                .assertNext(result -> {
                    assertThat(result.isDeadlineExceeded()).isTrue();
                    assertThat(result.getSucceeded()).isEqualTo(2);
                    assertThat(result.getFailures()).extracting(BatchFailure::getErrorType)
                            .containsExactly(BatchFailure.DEADLINE_EXCEEDED);
                    assertThat(result.getFailures().get(0).getOpportunityId()).isEqualTo("opp-slow");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    private static MatchScore scored(String opportunityId) {
        MatchScore m = new MatchScore();
        m.setId("score-" + opportunityId);
        m.setOpportunityId(opportunityId);
        m.setOverallScore(50);
        return m;
    }
}
