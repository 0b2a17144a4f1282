package com.example.matchscore.model.feedback;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Getter
@Setter
@Document(collection = "match_feedback")
@CompoundIndex(name = "org_score", def = "{'organizationId': 1, 'scoreId': 1, 'createdAt': 1}")
@Schema(description = "User feedback on a computed score; append-only")
public class FeedbackRecord {
    @Id
    private String id;

    private String scoreId;
    private String organizationId;

    @Schema(description = "Rating 1-5", example = "4")
    private Integer rating;

    private String comment;

    private Outcome outcome;

    private CalibrationSignal calibration;

    private Instant createdAt;
}
