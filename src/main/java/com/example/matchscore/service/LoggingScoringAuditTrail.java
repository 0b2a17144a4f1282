package com.example.matchscore.service;

import com.example.matchscore.model.batch.BatchResult;
import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.score.MatchScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingScoringAuditTrail implements ScoringAuditTrail {

    private static final Logger log = LoggerFactory.getLogger("matchscore.audit");

    private final NotificationPolicy notificationPolicy;

    public LoggingScoringAuditTrail(NotificationPolicy notificationPolicy) {
        this.notificationPolicy = notificationPolicy;
    }

    @Override
    public void scoreCreated(MatchScore score) {
        try {
            boolean notify = notificationPolicy.assess(score).isShouldNotify();
            log.info("score.created id={} org={} profile={} opportunity={} overall={} confidence={} method={} degraded={} notify={}",
                    score.getId(), score.getOrganizationId(), score.getProfileId(), score.getOpportunityId(),
                    score.getOverallScore(), score.getConfidence(), score.getScoringMethod().value(),
                    score.isDegraded(), notify);
        } catch (RuntimeException e) {
            log.warn("audit scoreCreated failed: {}", e.toString());
        }
    }

    @Override
    public void batchCompleted(String orgId, BatchResult result) {
        try {
            log.info("batch.completed org={} profile={} requested={} succeeded={} failed={} deadlineExceeded={} durationMs={}",
                    orgId, result.getProfileId(), result.getRequested(), result.getSucceeded(), result.getFailed(),
                    result.isDeadlineExceeded(), result.getDurationMs());
        } catch (RuntimeException e) {
            log.warn("audit batchCompleted failed: {}", e.toString());
        }
    }

    @Override
    public void feedbackRecorded(FeedbackRecord feedback) {
        try {
            log.info("feedback.recorded id={} org={} score={} rating={} outcome={}",
                    feedback.getId(), feedback.getOrganizationId(), feedback.getScoreId(), feedback.getRating(),
                    feedback.getOutcome() == null ? null : feedback.getOutcome().value());
        } catch (RuntimeException e) {
            log.warn("audit feedbackRecorded failed: {}", e.toString());
        }
    }
}
