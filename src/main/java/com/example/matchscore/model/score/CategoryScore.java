package com.example.matchscore.model.score;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Category sub-score with its weight and contribution to the overall score")
public class CategoryScore {
    private ScoringCategory category;

    @Schema(description = "Category score (0-100)", example = "80")
    private int score;

    @Schema(description = "Category weight (percent)", example = "35")
    private int weight;

    @Schema(description = "score * weight / 100", example = "28.0")
    private double contribution;

    private String details;

    private List<FactorResult> factors = new ArrayList<>();

    public CategoryScore(ScoringCategory category, int score, int weight, String details, List<FactorResult> factors) {
        this.category = category;
        this.score = score;
        this.weight = weight;
        this.contribution = score * weight / 100.0;
        this.details = details;
        this.factors = factors;
    }

    public FactorResult factor(FactorType type) {
        for (FactorResult f : factors) {
            if (f.getFactor() == type) return f;
        }
        return null;
    }
}
