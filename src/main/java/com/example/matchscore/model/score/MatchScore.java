package com.example.matchscore.model.score;

import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.evidence.FactorEvidence;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Document(collection = "match_scores")
@CompoundIndexes({
        @CompoundIndex(name = "org_created", def = "{'organizationId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "pair_created", def = "{'organizationId': 1, 'profileId': 1, 'opportunityId': 1, 'createdAt': -1}")
})
@Schema(description = "Computed compatibility between a profile and an opportunity")
public class MatchScore {
    @Id
    private String id;

    private String organizationId;
    private String profileId;
    private String opportunityId;

    @Schema(description = "Overall score (0-100)", example = "80")
    private int overallScore;

    @Schema(description = "Confidence in the score, driven by data completeness (0-100)", example = "72")
    private int confidence;

    private CategoryScore pastPerformance;
    private CategoryScore technicalCapability;
    private CategoryScore strategicFit;
    private CategoryScore credibility;

    @Schema(example = "v4.0-research-based")
    private String algorithmVersion;

    private ScoringMethod scoringMethod;

    @Schema(description = "Typed evidence keyed by factor")
    private Map<String, FactorEvidence> factorEvidence = new LinkedHashMap<>();

    private SemanticAnalysis semanticAnalysis;
    private StrategicInsights strategicInsights;

    private List<String> recommendations = new ArrayList<>();

    @Schema(description = "Weighted-sum score before any hybrid adjustment", example = "78")
    private int deterministicScore;

    private ScoreAdjustment adjustment;

    @Schema(description = "True when enrichment was requested but could not be applied")
    private boolean degraded;
    private String degradationReason;

    private String enrichmentModel;
    private long processingTimeMs;

    @Schema(description = "Language-model cost in USD", example = "0.0021")
    private double costUsd;

    private Instant createdAt;

    @JsonIgnore
    public CategoryScore category(ScoringCategory category) {
        if (category == ScoringCategory.PAST_PERFORMANCE) return pastPerformance;
        if (category == ScoringCategory.TECHNICAL_CAPABILITY) return technicalCapability;
        if (category == ScoringCategory.STRATEGIC_FIT) return strategicFit;
        return credibility;
    }

    public void putCategory(CategoryScore score) {
        ScoringCategory c = score.getCategory();
        if (c == ScoringCategory.PAST_PERFORMANCE) pastPerformance = score;
        else if (c == ScoringCategory.TECHNICAL_CAPABILITY) technicalCapability = score;
        else if (c == ScoringCategory.STRATEGIC_FIT) strategicFit = score;
        else credibility = score;
    }

    @JsonIgnore
    public List<CategoryScore> categories() {
        List<CategoryScore> out = new ArrayList<>(4);
        for (ScoringCategory c : ScoringCategory.values()) {
            CategoryScore s = category(c);
            if (s != null) out.add(s);
        }
        return out;
    }

    @JsonIgnore
    public FactorResult factor(FactorType type) {
        CategoryScore c = category(type.category());
        return c == null ? null : c.factor(type);
    }

    /** Shallow copy; enrichment fills the copy so a cached base score is never mutated. */
    public MatchScore copy() {
        MatchScore m = new MatchScore();
        m.id = id;
        m.organizationId = organizationId;
        m.profileId = profileId;
        m.opportunityId = opportunityId;
        m.overallScore = overallScore;
        m.confidence = confidence;
        m.pastPerformance = pastPerformance;
        m.technicalCapability = technicalCapability;
        m.strategicFit = strategicFit;
        m.credibility = credibility;
        m.algorithmVersion = algorithmVersion;
        m.scoringMethod = scoringMethod;
        m.factorEvidence = new LinkedHashMap<>(factorEvidence);
        m.semanticAnalysis = semanticAnalysis;
        m.strategicInsights = strategicInsights;
        m.recommendations = new ArrayList<>(recommendations);
        m.deterministicScore = deterministicScore;
        m.adjustment = adjustment;
        m.degraded = degraded;
        m.degradationReason = degradationReason;
        m.enrichmentModel = enrichmentModel;
        m.processingTimeMs = processingTimeMs;
        m.costUsd = costUsd;
        m.createdAt = createdAt;
        return m;
    }
}
