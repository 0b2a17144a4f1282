package com.example.matchscore.service.scoring;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.score.CategoryScore;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.model.score.ScoringCategory;
import com.example.matchscore.model.score.ScoringWeights;
import com.example.matchscore.service.scoring.factor.FactorEvaluator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted four-category score. No I/O; the only ambient input is the injected clock.
 */
@Service
public class DeterministicScorer {

    private final Map<FactorType, FactorEvaluator> evaluators = new EnumMap<>(FactorType.class);
    private final RecommendationGenerator recommendations;
    private final Clock clock;
    private final String algorithmVersion;

    public DeterministicScorer(List<FactorEvaluator> evaluators,
                               RecommendationGenerator recommendations,
                               Clock clock,
                               @Value("${matchscore.scoring.algorithm-version:v4.0-research-based}") String algorithmVersion) {
        for (FactorEvaluator e : evaluators) {
            this.evaluators.put(e.type(), e);
        }
        for (FactorType t : FactorType.values()) {
            if (!this.evaluators.containsKey(t)) throw new IllegalStateException("No evaluator for factor " + t.value());
        }
        this.recommendations = recommendations;
        this.clock = clock;
        this.algorithmVersion = algorithmVersion;
    }

    public String algorithmVersion() {
        return algorithmVersion;
    }

    public MatchScore score(Profile profile, Opportunity opportunity, ScoringWeights weights) {
        ScoringWeights w = weights == null ? ScoringWeights.defaults() : weights.validate();

        MatchScore m = new MatchScore();
        m.setOrganizationId(profile.getOrganizationId());
        m.setProfileId(profile.getId());
        m.setOpportunityId(opportunity.getId());

        double availability = 0;
        for (ScoringCategory category : ScoringCategory.values()) {
            List<FactorResult> factors = new ArrayList<>();
            double weighted = 0;
            double available = 0;
            for (FactorType type : category.factors()) {
                FactorResult f = evaluators.get(type).evaluate(profile, opportunity);
                factors.add(f);
                weighted += f.getScore() * f.getWeight();
                available += f.getDataAvailability() * f.getWeight();
                m.getFactorEvidence().put(type.value(), f.getEvidence());
            }
            int categoryScore = clamp((int) Math.round(weighted / 100.0));
            availability += available / 100.0;
            m.putCategory(new CategoryScore(category, categoryScore, w.weightOf(category),
                    details(factors), factors));
        }

        int overall = overall(m.categories());
        m.setOverallScore(overall);
        m.setDeterministicScore(overall);
        m.setConfidence(confidence(availability / ScoringCategory.values().length));
        m.setAlgorithmVersion(algorithmVersion);
        m.setScoringMethod(ScoringMethod.CALCULATION);
        m.setRecommendations(recommendations.generate(m, opportunity));
        m.setCreatedAt(clock.instant());
        return m;
    }

    /** round(sum of score * weight / 100), clamped to [0, 100]. */
    public static int overall(Collection<CategoryScore> categories) {
        double sum = 0;
        for (CategoryScore c : categories) {
            sum += c.getScore() * (double) c.getWeight();
        }
        return clamp((int) Math.round(sum / 100.0));
    }

    /** Driven by how much input data was present, not by how high the score is. */
    static int confidence(double meanAvailability) {
        return clamp((int) Math.round(10 + 90 * meanAvailability));
    }

    private static String details(List<FactorResult> factors) {
        if (factors.size() == 1) return factors.get(0).getDetails();
        StringBuilder sb = new StringBuilder();
        for (FactorResult f : factors) {
            if (sb.length() > 0) sb.append("; ");
            sb.append(f.getFactor().value()).append(' ').append(f.getScore());
        }
        return sb.toString();
    }

    static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }
}
