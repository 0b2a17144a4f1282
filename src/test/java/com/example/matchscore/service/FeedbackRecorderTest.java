package com.example.matchscore.service;

import com.example.matchscore.Fixtures;
import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.model.feedback.CalibrationSignal;
import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.feedback.Outcome;
import com.example.matchscore.model.request.FeedbackRequest;
import com.example.matchscore.model.request.ScoreRequest;
import com.example.matchscore.model.score.MatchScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

class FeedbackRecorderTest {

    private TestServices t;
    private FeedbackRecorder recorder;

    @BeforeEach
    void setUp() {
        t = new TestServices();
        recorder = t.feedback();
    }

    private MatchScore scoreOnce() {
        ScoreRequest r = new ScoreRequest();
        r.setProfileId("prof-1");
        r.setOpportunityId("opp-1");
        return t.scoring.score(Fixtures.ORG, r).block();
    }

    private static FeedbackRequest feedback(Integer rating, String comment, Outcome outcome) {
        FeedbackRequest f = new FeedbackRequest();
        f.setRating(rating);
        f.setComment(comment);
        f.setOutcome(outcome);
        return f;
    }

    @Test
    void feedbackEvictsCachedScoreOfThePair() {
        MatchScore first = scoreOnce();
        assertThat(scoreOnce().getId()).isEqualTo(first.getId());

        StepVerifier.create(recorder.recordFeedback(Fixtures.ORG, first.getId(), feedback(4, "Useful", Outcome.WON)))
                .assertNext(f -> {
                    assertThat(f.getId()).isNotNull();
                    assertThat(f.getScoreId()).isEqualTo(first.getId());
                    assertThat(f.getCalibration().isPredictionCorrect()).isTrue();
                    assertThat(f.getCreatedAt()).isEqualTo(Fixtures.CLOCK.instant());
                })
                .verifyComplete();

        MatchScore after = scoreOnce();
        assertThat(after.getId()).isNotEqualTo(first.getId());
        assertThat(t.store.scoreCount()).isEqualTo(2);
        verify(t.audit).feedbackRecorded(any(FeedbackRecord.class));
    }

    @Test
    void storedScoreIsNotModified() {
        MatchScore first = scoreOnce();
        int overall = first.getOverallScore();
        recorder.recordFeedback(Fixtures.ORG, first.getId(), feedback(null, null, Outcome.LOST)).block();

        assertThat(t.scoring.getScore(Fixtures.ORG, first.getId()).block().getOverallScore()).isEqualTo(overall);
    }

    @Test
    void feedbackIsListedInOrder() {
        MatchScore s = scoreOnce();
        recorder.recordFeedback(Fixtures.ORG, s.getId(), feedback(5, null, null)).block();
        recorder.recordFeedback(Fixtures.ORG, s.getId(), feedback(null, "Second thoughts", null)).block();

        StepVerifier.create(recorder.listFeedback(Fixtures.ORG, s.getId()))
                .assertNext(f -> assertThat(f.getRating()).isEqualTo(5))
                .assertNext(f -> assertThat(f.getComment()).isEqualTo("Second thoughts"))
                .verifyComplete();
    }

    @Test
    void unknownScoreIsNotFound() {
        StepVerifier.create(recorder.recordFeedback(Fixtures.ORG, "missing", feedback(3, null, null)))
                .expectError(NotFoundException.class)
                .verify();
        StepVerifier.create(recorder.listFeedback("org-2", "missing"))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void invalidFeedbackIsRejected() {
        assertThatThrownBy(() -> FeedbackRecorder.validate(feedback(null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> FeedbackRecorder.validate(feedback(6, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> FeedbackRecorder.validate(feedback(null, "x".repeat(2001), null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> FeedbackRecorder.validate(feedback(null, "   ", null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void calibrationSignals() {
        CalibrationSignal wonHigh = FeedbackRecorder.calibrate(75, Outcome.WON);
        assertThat(wonHigh.isPredictionCorrect()).isTrue();
        assertThat(wonHigh.getAccuracyDelta()).isCloseTo(0.01, within(1e-9));
        assertThat(wonHigh.getConfidenceAdjustment()).isCloseTo(0.05, within(1e-9));

        CalibrationSignal wonLow = FeedbackRecorder.calibrate(40, Outcome.WON);
        assertThat(wonLow.isPredictionCorrect()).isFalse();
        assertThat(wonLow.getConfidenceAdjustment()).isCloseTo(-0.20, within(1e-9));

        CalibrationSignal lostHigh = FeedbackRecorder.calibrate(85, Outcome.LOST);
        assertThat(lostHigh.getAccuracyDelta()).isCloseTo(-0.01, within(1e-9));
        assertThat(lostHigh.getConfidenceAdjustment()).isCloseTo(-0.15, within(1e-9));

        assertThat(FeedbackRecorder.calibrate(60, Outcome.LOST).isPredictionCorrect()).isTrue();
        assertThat(FeedbackRecorder.calibrate(72, Outcome.LOST).getConfidenceAdjustment()).isZero();

        CalibrationSignal noBid = FeedbackRecorder.calibrate(75, Outcome.NO_BID);
        assertThat(noBid.isPredictionCorrect()).isFalse();
        assertThat(noBid.getConfidenceAdjustment()).isZero();
    }
}
