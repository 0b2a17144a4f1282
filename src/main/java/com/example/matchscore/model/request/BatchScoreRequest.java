package com.example.matchscore.model.request;

import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.score.ScoringWeights;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Schema(description = "Score many opportunities for one profile")
public class BatchScoreRequest {
    private String profileId;

    private List<String> opportunityIds = new ArrayList<>();

    @Schema(description = "Items scored in parallel (1..max, default 5)", example = "5")
    private Integer concurrency;

    private ScoringMethod method = ScoringMethod.CALCULATION;

    private ScoringWeights weights;

    @Schema(description = "Overall deadline in milliseconds; unfinished items are reported as failures")
    private Long deadlineMs;
}
