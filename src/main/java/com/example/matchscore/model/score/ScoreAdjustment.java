package com.example.matchscore.model.score;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bounded hybrid adjustment applied on top of the deterministic score")
public class ScoreAdjustment {
    @Schema(description = "Points added to the deterministic score (may be negative)", example = "4")
    private int delta;

    @Schema(description = "Model-suggested overall score", example = "72")
    private int suggestedScore;

    @Schema(example = "0.3")
    private double blendRatio;

    @Schema(description = "Largest allowed |delta|", example = "10")
    private int maxAdjustment;

    private String rationale;
}
