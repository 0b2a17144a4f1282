package com.example.matchscore.model.batch;

import com.example.matchscore.model.score.MatchScore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Schema(description = "Latest stored score per opportunity, and the opportunities that still need scoring")
public class BulkCheckResult {
    private String profileId;

    @Schema(description = "Distinct opportunities requested")
    private int totalRequested;

    @Schema(description = "Latest score per opportunity id, in request order")
    private Map<String, MatchScore> existingScores = new LinkedHashMap<>();

    private List<String> missingIds = new ArrayList<>();

    public int getFoundCount() {
        return existingScores.size();
    }
}
