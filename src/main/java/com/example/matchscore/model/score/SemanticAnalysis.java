package com.example.matchscore.model.score;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Language-model reading of the solicitation")
public class SemanticAnalysis {
    private List<String> implicitRequirements = new ArrayList<>();
    private List<String> hiddenPreferences = new ArrayList<>();
    private List<EvaluationCriterion> evaluationCriteriaPrediction = new ArrayList<>();
    private CompetitiveLandscape competitiveLandscape = new CompetitiveLandscape();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationCriterion {
        private String criterion;
        private Integer estimatedWeight;
        private String evidence;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompetitiveLandscape {
        private String likelyIncumbent;
        private Integer estimatedCompetitors;
        private List<String> competitorProfiles = new ArrayList<>();
        private List<String> incumbentVulnerabilities = new ArrayList<>();
    }
}
