package com.example.matchscore.model.batch;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One opportunity that could not be scored")
public class BatchFailure {
    public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";

    private String opportunityId;

    @Schema(example = "NOT_FOUND")
    private String errorType;

    private String message;
}
