package com.example.matchscore.model.score;

import com.example.matchscore.model.evidence.FactorEvidence;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Sub-score for one factor")
public class FactorResult {
    private FactorType factor;

    @Schema(description = "Sub-score (0-100)")
    private int score;

    @Schema(description = "Sub-weight inside the owning category")
    private int weight;

    private String details;

    private FactorEvidence evidence;

    @Schema(description = "Share of the inputs this factor needs that were present (0-1)")
    private double dataAvailability = 1.0;

    @Schema(description = "Free-text evidence notes")
    private Map<String, String> notes = new LinkedHashMap<>();

    public FactorResult(FactorType factor, int score, String details, FactorEvidence evidence) {
        this.factor = factor;
        this.score = Math.max(0, Math.min(100, score));
        this.weight = factor.subWeight();
        this.details = details;
        this.evidence = evidence;
    }

    public FactorResult availability(double availability) {
        this.dataAvailability = Math.max(0.0, Math.min(1.0, availability));
        return this;
    }

    public FactorResult note(String key, String value) {
        if (value != null) notes.put(key, value);
        return this;
    }
}
