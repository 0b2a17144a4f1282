package com.example.matchscore.model.request;

import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.score.ScoringWeights;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Score a single profile/opportunity pair")
public class ScoreRequest {
    @Schema(example = "prof-1")
    private String profileId;

    @Schema(example = "opp-1")
    private String opportunityId;

    @Schema(description = "calculation, llm or hybrid", example = "calculation")
    private ScoringMethod method = ScoringMethod.CALCULATION;

    @Schema(description = "Optional category weights; defaults 35/35/15/15")
    private ScoringWeights weights;

    @Schema(description = "Skip the cache and recompute")
    private boolean forceRefresh;
}
