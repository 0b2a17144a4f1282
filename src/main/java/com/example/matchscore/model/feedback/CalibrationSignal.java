package com.example.matchscore.model.feedback;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "How well the predicted score matched the reported outcome")
public class CalibrationSignal {
    private int predictedScore;
    private Outcome outcome;

    @Schema(description = "True when the prediction agreed with the outcome (threshold 70)")
    private boolean predictionCorrect;

    @Schema(example = "0.01")
    private double accuracyDelta;

    @Schema(example = "-0.15")
    private double confidenceAdjustment;

    private String note;
}
