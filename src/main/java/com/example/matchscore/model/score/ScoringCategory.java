package com.example.matchscore.model.score;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

@Schema(description = "Weighted scoring category")
public enum ScoringCategory {
    PAST_PERFORMANCE("pastPerformance"),
    TECHNICAL_CAPABILITY("technicalCapability"),
    STRATEGIC_FIT("strategicFit"),
    CREDIBILITY("credibility");

    private final String value;

    ScoringCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Factors rolled into this category, in declaration order; their sub-weights sum to 100. */
    public List<FactorType> factors() {
        List<FactorType> out = new ArrayList<>();
        for (FactorType f : FactorType.values()) {
            if (f.category() == this) out.add(f);
        }
        return out;
    }
}
