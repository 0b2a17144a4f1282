package com.example.matchscore.model.score;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Single scoring dimension and its sub-weight inside its category")
public enum FactorType {
    PAST_PERFORMANCE("past_performance", ScoringCategory.PAST_PERFORMANCE, 100),
    INDUSTRY_CODE("industry_code", ScoringCategory.TECHNICAL_CAPABILITY, 50),
    CERTIFICATION("certification", ScoringCategory.TECHNICAL_CAPABILITY, 25),
    COMPETENCY("competency", ScoringCategory.TECHNICAL_CAPABILITY, 15),
    SECURITY_CLEARANCE("security_clearance", ScoringCategory.TECHNICAL_CAPABILITY, 10),
    GEOGRAPHY("geography", ScoringCategory.STRATEGIC_FIT, 60),
    GOVERNMENT_LEVEL("government_level", ScoringCategory.STRATEGIC_FIT, 40),
    CREDIBILITY("credibility", ScoringCategory.CREDIBILITY, 100);

    private final String value;
    private final ScoringCategory category;
    private final int subWeight;

    FactorType(String value, ScoringCategory category, int subWeight) {
        this.value = value;
        this.category = category;
        this.subWeight = subWeight;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public ScoringCategory category() {
        return category;
    }

    public int subWeight() {
        return subWeight;
    }
}
