package com.example.matchscore.model.request;

import com.example.matchscore.model.feedback.Outcome;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Feedback on a score; at least one field is required")
public class FeedbackRequest {
    @Schema(description = "Rating 1-5", example = "4")
    private Integer rating;

    @Schema(description = "Free text, at most 2000 characters")
    private String comment;

    private Outcome outcome;
}
