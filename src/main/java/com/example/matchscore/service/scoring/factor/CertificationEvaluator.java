package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Certification;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.CertificationEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Set-aside eligibility and required certifications. When an opportunity carries both,
 * the factor score is the mean of the two parts.
 */
@Component
public class CertificationEvaluator implements FactorEvaluator {

    @Override
    public FactorType type() {
        return FactorType.CERTIFICATION;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        String setAside = blankToNull(opportunity.getSetAsideType());
        List<String> required = new ArrayList<>();
        if (opportunity.getRequiredCertifications() != null) {
            for (String r : opportunity.getRequiredCertifications()) {
                if (r != null && !r.isBlank()) required.add(r.trim());
            }
        }

        List<String> held = activeCodes(profile);
        if (setAside == null && required.isEmpty()) {
            return new FactorResult(type(), 100, "No set-aside or certification required",
                    new CertificationEvidence(null, required, List.of(), true));
        }

        List<String> matchedSources = new ArrayList<>();
        Integer setAsideScore = null;
        if (setAside != null) {
            List<String> sources = new ArrayList<>();
            for (String h : held) {
                if (SetAsideAliases.satisfies(h, setAside)) sources.add(h);
            }
            if (profile.getSetAsides() != null) {
                for (String flag : profile.getSetAsides()) {
                    if (flag != null && SetAsideAliases.satisfies(flag, setAside) && !sources.contains(flag)) {
                        sources.add(flag);
                    }
                }
            }
            matchedSources.addAll(sources);
            setAsideScore = sources.isEmpty() ? 0 : Math.min(100, 70 + 15 * sources.size());
        }

        Integer requiredScore = null;
        int requiredMatched = 0;
        if (!required.isEmpty()) {
            for (String r : required) {
                for (String h : held) {
                    if (SetAsideAliases.canonical(h).equals(SetAsideAliases.canonical(r))) {
                        requiredMatched++;
                        if (!matchedSources.contains(h)) matchedSources.add(h);
                        break;
                    }
                }
            }
            requiredScore = (int) Math.round(requiredMatched * 100.0 / required.size());
        }

        int score;
        if (setAsideScore != null && requiredScore != null) {
            score = (int) Math.round((setAsideScore + requiredScore) / 2.0);
        } else {
            score = setAsideScore != null ? setAsideScore : requiredScore;
        }
        boolean eligible = (setAsideScore == null || setAsideScore > 0)
                && (requiredScore == null || requiredMatched == required.size());

        StringBuilder details = new StringBuilder();
        if (setAside != null) {
            details.append(setAsideScore > 0
                    ? "Eligible for " + setAside + " set-aside via " + String.join(", ", matchedSources)
                    : "Not eligible for " + setAside + " set-aside");
        }
        if (requiredScore != null) {
            if (details.length() > 0) details.append("; ");
            details.append(requiredMatched).append("/").append(required.size()).append(" required certifications held");
        }

        return new FactorResult(type(), score, details.toString(),
                new CertificationEvidence(setAside, required, matchedSources, eligible))
                .note("heldCertifications", String.join(", ", held));
    }

    private static List<String> activeCodes(Profile profile) {
        List<String> out = new ArrayList<>();
        if (profile.getCertifications() == null) return out;
        for (Certification c : profile.getCertifications()) {
            if (c != null && c.getType() != null && !c.getType().isBlank() && c.isActive()) out.add(c.getType().trim());
        }
        return out;
    }

    private static String blankToNull(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        return t.equalsIgnoreCase("none") ? null : t;
    }
}
