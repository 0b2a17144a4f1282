package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.CredibilityEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

import java.util.Collection;

/** Profile completeness (two thirds) and federal registration readiness (one third). */
@Component
public class CredibilityEvaluator implements FactorEvaluator {

    @Override
    public FactorType type() {
        return FactorType.CREDIBILITY;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        boolean declared = profile.getCompletenessPercentage() != null;
        int completeness = declared
                ? Math.max(0, Math.min(100, profile.getCompletenessPercentage()))
                : estimateCompleteness(profile);

        boolean hasUei = notBlank(profile.getUei());
        boolean hasCage = notBlank(profile.getCageCode());
        int readiness = (profile.isSamRegistered() ? 50 : 0) + (hasUei ? 25 : 0) + (hasCage ? 25 : 0);

        int score = Math.max(10, (int) Math.round(0.67 * completeness + 0.33 * readiness));
        String details = "Profile " + completeness + "% complete; registration readiness " + readiness + "%";
        return new FactorResult(type(), score, details,
                new CredibilityEvidence(completeness, profile.isSamRegistered(), hasUei, hasCage, readiness))
                .availability(declared ? 1.0 : 0.5)
                .note("completenessSource", declared ? "declared" : "estimated");
    }

    static int estimateCompleteness(Profile p) {
        int filled = 0;
        int total = 8;
        if (notBlank(p.getCompanyName())) filled++;
        if (notBlank(p.getPrimaryIndustryCode())) filled++;
        if (notBlank(p.getState())) filled++;
        if (notEmpty(p.getCertifications()) || notEmpty(p.getSetAsides())) filled++;
        if (notEmpty(p.getCapabilityKeywords())) filled++;
        if (p.getPastPerformance() != null
                && (notBlank(p.getPastPerformance().getDescription()) || notEmpty(p.getPastPerformance().getProjects()))) {
            filled++;
        }
        if (notEmpty(p.getGovernmentLevels())) filled++;
        if (notBlank(p.getUei()) || notBlank(p.getCageCode())) filled++;
        return (int) Math.round(filled * 100.0 / total);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static boolean notEmpty(Collection<?> c) {
        return c != null && !c.isEmpty();
    }
}
