package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.GeographyEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

@Component
public class GeographyEvaluator implements FactorEvaluator {

    @Override
    public FactorType type() {
        return FactorType.GEOGRAPHY;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        String ps = upper(profile.getState());
        String os = upper(opportunity.getState());

        if (opportunity.isNationwide()) {
            return new FactorResult(type(), 50, "Nationwide or multi-location performance",
                    new GeographyEvidence(ps, os, true, false, false));
        }
        if (ps == null || os == null) {
            return new FactorResult(type(), 40, "Location unknown on the " + (ps == null ? "profile" : "opportunity"),
                    new GeographyEvidence(ps, os, false, false, false))
                    .availability(0.0);
        }
        if (!ps.equals(os)) {
            return new FactorResult(type(), 25, "Different state (" + ps + " vs " + os + ")",
                    new GeographyEvidence(ps, os, false, false, false));
        }
        String pc = upper(profile.getCity());
        String oc = upper(opportunity.getCity());
        boolean sameCity = pc != null && pc.equals(oc);
        return new FactorResult(type(), sameCity ? 100 : 75,
                sameCity ? "Same city and state" : "Same state (" + ps + ")",
                new GeographyEvidence(ps, os, false, true, sameCity));
    }

    private static String upper(String s) {
        if (s == null || s.isBlank()) return null;
        return s.trim().toUpperCase();
    }
}
