package com.example.matchscore.model.score;

import com.example.matchscore.exception.ValidationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Category weights in percent; must sum to 100")
public class ScoringWeights {
    @Schema(example = "35")
    private int pastPerformance;
    @Schema(example = "35")
    private int technicalCapability;
    @Schema(example = "15")
    private int strategicFit;
    @Schema(example = "15")
    private int credibility;

    public static ScoringWeights defaults() {
        return new ScoringWeights(35, 35, 15, 15);
    }

    public int weightOf(ScoringCategory category) {
        if (category == ScoringCategory.PAST_PERFORMANCE) return pastPerformance;
        if (category == ScoringCategory.TECHNICAL_CAPABILITY) return technicalCapability;
        if (category == ScoringCategory.STRATEGIC_FIT) return strategicFit;
        return credibility;
    }

    public int total() {
        return pastPerformance + technicalCapability + strategicFit + credibility;
    }

    public ScoringWeights validate() {
        if (pastPerformance < 0 || technicalCapability < 0 || strategicFit < 0 || credibility < 0) {
            throw new ValidationException("Category weights must not be negative");
        }
        if (total() != 100) {
            throw new ValidationException("Category weights must sum to 100 (got " + total() + ")");
        }
        return this;
    }
}
