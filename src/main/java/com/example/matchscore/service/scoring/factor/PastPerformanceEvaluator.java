package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.PastPerformance;
import com.example.matchscore.model.PastPerformance.PastProject;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.PastPerformanceEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.List;

/**
 * Past performance: a base for having itemized work, a dollar-scale bonus against the
 * opportunity value, and bonuses for government customers, recency and volume.
 */
@Component
public class PastPerformanceEvaluator implements FactorEvaluator {

    static final int MAX_PROJECTS = 50;
    static final int RECENT_YEARS = 3;

    private final Clock clock;

    public PastPerformanceEvaluator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public FactorType type() {
        return FactorType.PAST_PERFORMANCE;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        PastPerformance pp = profile.getPastPerformance();
        boolean narrative = pp != null && pp.getDescription() != null && !pp.getDescription().isBlank();
        List<PastProject> projects = pp == null || pp.getProjects() == null ? List.of() : pp.getProjects();
        if (projects.size() > MAX_PROJECTS) projects = projects.subList(0, MAX_PROJECTS);

        Double oppValue = opportunity.getEstimatedValue() == null ? null : opportunity.getEstimatedValue().resolve();
        if (oppValue != null && oppValue <= 0) oppValue = null;

        if (projects.isEmpty()) {
            int score = narrative ? 40 : 30;
            return new FactorResult(type(), score,
                    narrative ? "Narrative past performance only; no itemized projects" : "No past performance on file",
                    new PastPerformanceEvidence(0, 0, 0, narrative, null, oppValue, null, false))
                    .availability(narrative ? 0.5 : 0.0);
        }

        int currentYear = Year.now(clock).getValue();
        int government = 0;
        int recent = 0;
        Double largest = null;
        for (PastProject p : projects) {
            if (p == null) continue;
            if (p.isGovernment()) government++;
            if (p.getCompletionYear() != null && p.getCompletionYear() >= currentYear - RECENT_YEARS) recent++;
            if (p.getValue() != null && p.getValue() > 0 && (largest == null || p.getValue() > largest)) {
                largest = p.getValue();
            }
        }

        Double ratio = largest != null && oppValue != null ? largest / oppValue : null;
        boolean mayExceed = false;
        int scaleBonus;
        String scaleNote;
        if (ratio != null) {
            if (ratio >= 1.0) {
                scaleBonus = 25;
                scaleNote = "prior work at or above this contract's size";
            } else if (ratio >= 0.5) {
                scaleBonus = 20;
                scaleNote = "prior work at least half this contract's size";
            } else if (ratio >= 0.25) {
                scaleBonus = 12;
                scaleNote = "prior work at least a quarter of this contract's size";
            } else if (ratio >= 0.1) {
                scaleBonus = 6;
                scaleNote = "prior work well below this contract's size";
            } else {
                scaleBonus = 2;
                mayExceed = true;
                scaleNote = "contract may exceed capacity";
            }
        } else {
            scaleBonus = absoluteScale(largest);
            scaleNote = largest == null ? "no project values on file" : "opportunity value unknown; absolute scale";
        }

        int score = 50 + scaleBonus
                + (government > 0 ? 10 : 0)
                + (recent > 0 ? 10 : 0)
                + Math.min(5, projects.size());
        score = Math.min(100, score);

        String details = projects.size() + " projects (" + government + " government, " + recent + " recent); " + scaleNote;
        return new FactorResult(type(), score, details,
                new PastPerformanceEvidence(projects.size(), government, recent, narrative, largest, oppValue, ratio, mayExceed))
                .availability(largest != null ? 1.0 : 0.75)
                .note("scale", scaleNote);
    }

    private static int absoluteScale(Double largest) {
        if (largest == null) return 5;
        if (largest >= 10_000_000) return 20;
        if (largest >= 1_000_000) return 15;
        if (largest >= 100_000) return 10;
        return 5;
    }
}
