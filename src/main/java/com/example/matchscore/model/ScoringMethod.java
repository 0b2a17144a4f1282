package com.example.matchscore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "How a score was produced")
public enum ScoringMethod {
    CALCULATION("calculation"),
    LLM("llm"),
    HYBRID("hybrid");

    private final String value;

    ScoringMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean needsEnrichment() {
        return this != CALCULATION;
    }

    @JsonCreator
    public static ScoringMethod from(String s) {
        if (s == null || s.isBlank()) return CALCULATION;
        String t = s.trim().toLowerCase();
        for (ScoringMethod m : values()) {
            if (m.value.equals(t)) return m;
        }
        return CALCULATION;
    }
}
