package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.CompetencyEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Capability keywords found in the opening of the opportunity description. */
@Component
public class CompetencyEvaluator implements FactorEvaluator {

    static final int MAX_KEYWORDS = 50;
    static final int MAX_TEXT = 10_000;

    @Override
    public FactorType type() {
        return FactorType.COMPETENCY;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        Set<String> keywords = new LinkedHashSet<>();
        if (profile.getCapabilityKeywords() != null) {
            for (String k : profile.getCapabilityKeywords()) {
                if (keywords.size() >= MAX_KEYWORDS) break;
                if (k != null && !k.isBlank()) keywords.add(k.trim().toLowerCase(Locale.ROOT));
            }
        }
        String text = text(opportunity);

        if (keywords.isEmpty() || text.isEmpty()) {
            return new FactorResult(type(), 30,
                    keywords.isEmpty() ? "No capability keywords on the profile" : "Opportunity has no description",
                    new CompetencyEvidence(keywords.size(), List.of()))
                    .availability(0.0);
        }

        List<String> matched = new ArrayList<>();
        for (String k : keywords) {
            if (text.contains(k)) matched.add(k);
        }
        int score = (int) Math.round(30 + 70.0 * matched.size() / keywords.size());
        return new FactorResult(type(), score, matched.size() + " of " + keywords.size() + " capability keywords found",
                new CompetencyEvidence(keywords.size(), matched));
    }

    private static String text(Opportunity opportunity) {
        String s = opportunity.getDescription() == null ? "" : opportunity.getDescription().trim();
        if (s.length() > MAX_TEXT) s = s.substring(0, MAX_TEXT);
        return s.toLowerCase(Locale.ROOT);
    }
}
