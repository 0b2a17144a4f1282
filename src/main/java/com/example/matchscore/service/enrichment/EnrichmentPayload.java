package com.example.matchscore.service.enrichment;

import com.example.matchscore.model.score.SemanticAnalysis;
import com.example.matchscore.model.score.StrategicInsights;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** Parsed JSON reply of the enrichment prompt. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichmentPayload {
    private SemanticAnalysis semanticAnalysis;
    private StrategicInsights strategicInsights;
    private Integer suggestedScore;
    private String scoreRationale;
}
