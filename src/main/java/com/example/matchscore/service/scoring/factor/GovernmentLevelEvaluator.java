package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.GovernmentLevel;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.GovernmentLevelEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GovernmentLevelEvaluator implements FactorEvaluator {

    @Override
    public FactorType type() {
        return FactorType.GOVERNMENT_LEVEL;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        GovernmentLevel level = GovernmentLevel.ofAgency(opportunity.getAgency());
        List<GovernmentLevel> preferred = profile.getGovernmentLevels() == null ? List.of() : profile.getGovernmentLevels();
        GovernmentLevelEvidence evidence = new GovernmentLevelEvidence(level, preferred);

        if (preferred.isEmpty()) {
            return new FactorResult(type(), 50, "No government level preference; opportunity is " + level, evidence)
                    .availability(0.0);
        }
        int best = 0;
        for (GovernmentLevel p : preferred) {
            if (p != null) best = Math.max(best, p.compatibilityWith(level));
        }
        String details = best == 100 ? "Prefers " + level + " work" : "Opportunity is " + level + "; preference is " + preferred;
        return new FactorResult(type(), best, details, evidence)
                .availability(opportunity.getAgency() == null || opportunity.getAgency().isBlank() ? 0.5 : 1.0);
    }
}
