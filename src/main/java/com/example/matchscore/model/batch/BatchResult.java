package com.example.matchscore.model.batch;

import com.example.matchscore.model.score.MatchScore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Schema(description = "Per-item outcome of a batch run")
public class BatchResult {
    private String profileId;

    @Schema(description = "Distinct opportunities requested")
    private int requested;

    private List<MatchScore> results = new ArrayList<>();
    private List<BatchFailure> failures = new ArrayList<>();

    private boolean deadlineExceeded;
    private long durationMs;

    public int getSucceeded() {
        return results.size();
    }

    public int getFailed() {
        return failures.size();
    }
}
