package com.example.matchscore.model.score;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Schema(description = "Whether a score is strong and trustworthy enough to notify the user")
public class NotificationReadiness {
    private boolean shouldNotify;
    private int matchScore;
    private int credibilityScore;
    private int confidence;
    private List<String> reasons = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
}
