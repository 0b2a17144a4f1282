package com.example.matchscore.service.scoring;

import com.example.matchscore.model.GovernmentLevel;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.evidence.ClearanceEvidence;
import com.example.matchscore.model.evidence.PastPerformanceEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import com.example.matchscore.model.score.MatchScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class RecommendationGenerator {

    public List<String> generate(MatchScore score, Opportunity opportunity) {
        List<String> out = new ArrayList<>();

        int industry = scoreOf(score, FactorType.INDUSTRY_CODE);
        if (industry >= 80) {
            out.add("Strong NAICS alignment makes this an excellent opportunity");
        } else if (industry < 40) {
            out.add("Consider building capabilities in the required NAICS codes");
        }

        if (!opportunity.isNationwide() && scoreOf(score, FactorType.GEOGRAPHY) < 60) {
            out.add("Consider partnering with local firms for geographic advantage");
        }

        String setAside = opportunity.getSetAsideType();
        if (scoreOf(score, FactorType.CERTIFICATION) < 50 && setAside != null && !setAside.isBlank()) {
            out.add("Consider obtaining " + setAside.replace('_', ' ').toLowerCase(Locale.ROOT) + " certification");
        }

        FactorResult pp = score.factor(FactorType.PAST_PERFORMANCE);
        if (pp != null && pp.getEvidence() instanceof PastPerformanceEvidence e && e.isMayExceedCapacity()) {
            out.add("Consider teaming arrangements due to contract size");
        }

        int credibility = scoreOf(score, FactorType.CREDIBILITY);
        if (credibility < 50) {
            out.add("Consider improving profile completeness and SAM.gov registration for better credibility");
        } else if (credibility >= 80) {
            out.add("Strong market presence - highlight your professional profile and government readiness");
        }

        int level = scoreOf(score, FactorType.GOVERNMENT_LEVEL);
        if (level < 50) {
            GovernmentLevel oppLevel = GovernmentLevel.ofAgency(opportunity.getAgency());
            out.add("Consider building experience with " + oppLevel.name().toLowerCase(Locale.ROOT) + " agencies");
        } else if (level >= 80) {
            out.add("Excellent government level match - highlight relevant experience");
        }

        FactorResult clearance = score.factor(FactorType.SECURITY_CLEARANCE);
        if (clearance != null && clearance.getScore() < 100 && clearance.getEvidence() instanceof ClearanceEvidence c) {
            out.add("Requires " + c.getRequired() + " clearance - consider teaming with a cleared partner");
        }

        if (scoreOf(score, FactorType.COMPETENCY) < 50) {
            out.add("Tailor your capability keywords to the solicitation's technical requirements");
        }
        return out;
    }

    private static int scoreOf(MatchScore score, FactorType type) {
        FactorResult f = score.factor(type);
        return f == null ? 0 : f.getScore();
    }
}
