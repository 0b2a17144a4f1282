package com.example.matchscore.model.score;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Win probability, gaps and teaming advice from the language model")
public class StrategicInsights {
    private WinProbability winProbability = new WinProbability();
    private List<Advantage> competitiveAdvantages = new ArrayList<>();
    private List<Gap> criticalGaps = new ArrayList<>();
    private List<TeamingRecommendation> teamingRecommendations = new ArrayList<>();

    @Schema(description = "STRONG_GO, GO, CONDITIONAL_GO or NO_GO", example = "GO")
    private String goNoGoRecommendation;
    private String decisionRationale;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WinProbability {
        @Schema(description = "Win probability (0-100)", example = "35")
        private Integer percentage;
        private String rationale;
        private Integer low;
        private Integer high;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Advantage {
        private String advantage;
        @Schema(example = "HIGH")
        private String impact;
        private String howToLeverage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Gap {
        private String gap;
        @Schema(description = "DISQUALIFYING, CRITICAL, IMPORTANT or MINOR")
        private String severity;
        private String mitigation;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TeamingRecommendation {
        private String partnerType;
        private String reason;
        @Schema(description = "IMMEDIATE, SOON or EVENTUAL")
        private String urgency;
    }
}
