package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.IndustryEvidence;
import com.example.matchscore.model.evidence.IndustryEvidence.MatchLevel;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** NAICS alignment: exact primary, secondary, 4-digit industry group, 2-digit sector. */
@Component
public class IndustryCodeEvaluator implements FactorEvaluator {

    @Override
    public FactorType type() {
        return FactorType.INDUSTRY_CODE;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        String primary = clean(profile.getPrimaryIndustryCode());
        List<String> secondary = cleanAll(profile.getSecondaryIndustryCodes());
        List<String> oppCodes = cleanAll(opportunity.getIndustryCodes());

        if (oppCodes.isEmpty() || (primary == null && secondary.isEmpty())) {
            String missing = oppCodes.isEmpty() ? "opportunity" : "profile";
            return new FactorResult(type(), 10, "No industry codes on the " + missing,
                    new IndustryEvidence(MatchLevel.NO_DATA, primary, null, oppCodes))
                    .availability(0.0);
        }

        List<String> own = new ArrayList<>();
        if (primary != null) own.add(primary);
        own.addAll(secondary);

        MatchLevel best = MatchLevel.NONE;
        String matched = null;
        for (String code : oppCodes) {
            MatchLevel level = levelFor(code, primary, secondary, own);
            if (level.ordinal() < best.ordinal()) {
                best = level;
                matched = code;
            }
        }

        int score;
        String details;
        if (best == MatchLevel.EXACT_PRIMARY) {
            score = 100;
            details = "Primary NAICS " + matched + " matches exactly";
        } else if (best == MatchLevel.SECONDARY) {
            score = 80;
            details = "Secondary NAICS " + matched + " matches";
        } else if (best == MatchLevel.INDUSTRY_GROUP) {
            score = 60;
            details = "Same industry group as " + matched;
        } else if (best == MatchLevel.SECTOR) {
            score = 40;
            details = "Same sector as " + matched;
        } else {
            score = 5;
            details = "No NAICS overlap with " + String.join(", ", oppCodes);
        }
        return new FactorResult(type(), score, details, new IndustryEvidence(best, primary, matched, oppCodes))
                .availability(primary != null ? 1.0 : 0.75);
    }

    private static MatchLevel levelFor(String code, String primary, List<String> secondary, List<String> own) {
        if (code.equals(primary)) return MatchLevel.EXACT_PRIMARY;
        if (secondary.contains(code)) return MatchLevel.SECONDARY;
        for (String c : own) {
            if (sharesPrefix(c, code, 4)) return MatchLevel.INDUSTRY_GROUP;
        }
        for (String c : own) {
            if (sharesPrefix(c, code, 2)) return MatchLevel.SECTOR;
        }
        return MatchLevel.NONE;
    }

    private static boolean sharesPrefix(String a, String b, int len) {
        return a.length() >= len && b.length() >= len && a.regionMatches(0, b, 0, len);
    }

    private static String clean(String code) {
        if (code == null) return null;
        String t = code.trim();
        return t.isEmpty() ? null : t;
    }

    private static List<String> cleanAll(List<String> codes) {
        List<String> out = new ArrayList<>();
        if (codes == null) return out;
        for (String c : codes) {
            String t = clean(c);
            if (t != null && !out.contains(t)) out.add(t);
        }
        return out;
    }
}
