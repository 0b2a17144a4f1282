package com.example.matchscore.service;

import com.example.matchscore.model.batch.BatchResult;
import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.score.MatchScore;

/**
 * Best-effort side channel for scoring events (audit, notifications, analytics).
 * Implementations must not throw; a failed side effect never fails the scoring call.
 */
public interface ScoringAuditTrail {

    void scoreCreated(MatchScore score);

    void batchCompleted(String orgId, BatchResult result);

    void feedbackRecorded(FeedbackRecord feedback);
}
