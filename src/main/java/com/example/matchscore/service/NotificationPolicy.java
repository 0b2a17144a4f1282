package com.example.matchscore.service;

import com.example.matchscore.model.score.CategoryScore;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.model.score.NotificationReadiness;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Decides whether a score is worth a user notification. */
@Component
public class NotificationPolicy {

    private final int minimumMatch;
    private final int minimumCredibility;
    private final int minimumConfidence;

    public NotificationPolicy(@Value("${matchscore.notification.minimum-match:75}") int minimumMatch,
                              @Value("${matchscore.notification.minimum-credibility:60}") int minimumCredibility,
                              @Value("${matchscore.notification.minimum-confidence:65}") int minimumConfidence) {
        this.minimumMatch = minimumMatch;
        this.minimumCredibility = minimumCredibility;
        this.minimumConfidence = minimumConfidence;
    }

    public NotificationReadiness assess(MatchScore score) {
        CategoryScore cred = score.getCredibility();
        int credibility = cred == null ? 0 : cred.getScore();
        int overall = score.getOverallScore();
        int confidence = score.getConfidence();

        NotificationReadiness r = new NotificationReadiness();
        r.setMatchScore(overall);
        r.setCredibilityScore(credibility);
        r.setConfidence(confidence);

        if (overall >= minimumMatch) {
            r.getReasons().add("Strong opportunity match (" + overall + "%)");
        } else {
            r.getReasons().add("Match score too low (" + overall + "% < " + minimumMatch + "%)");
            r.getRecommendations().add("Focus on improving NAICS alignment and past performance");
        }
        if (credibility >= minimumCredibility) {
            r.getReasons().add("Adequate profile credibility (" + credibility + "%)");
        } else {
            r.getReasons().add("Profile credibility insufficient (" + credibility + "% < " + minimumCredibility + "%)");
            r.getRecommendations().add("Complete basic company details and SAM.gov registration");
        }
        if (confidence >= minimumConfidence) {
            r.getReasons().add("High algorithm confidence (" + confidence + "%)");
        } else {
            r.getReasons().add("Algorithm confidence too low (" + confidence + "% < " + minimumConfidence + "%)");
            r.getRecommendations().add("Add more profile details to improve matching accuracy");
        }
        r.setShouldNotify(overall >= minimumMatch && credibility >= minimumCredibility && confidence >= minimumConfidence);
        return r;
    }
}
