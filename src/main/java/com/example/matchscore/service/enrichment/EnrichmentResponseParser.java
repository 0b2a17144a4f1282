package com.example.matchscore.service.enrichment;

import com.example.matchscore.exception.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class EnrichmentResponseParser {

    private final ObjectMapper mapper;

    public EnrichmentResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Accepts a bare JSON object, optionally wrapped in a markdown fence or surrounding prose. */
    public EnrichmentPayload parse(String text) {
        if (text == null || text.isBlank()) throw new ProviderException("Empty enrichment reply");
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) throw new ProviderException("Enrichment reply contains no JSON object");
        EnrichmentPayload payload;
        try {
            payload = mapper.readValue(text.substring(start, end + 1), EnrichmentPayload.class);
        } catch (Exception e) {
            throw new ProviderException("Malformed enrichment reply: " + e.getMessage(), e);
        }
        if (payload.getSemanticAnalysis() == null && payload.getStrategicInsights() == null) {
            throw new ProviderException("Enrichment reply has neither semanticAnalysis nor strategicInsights");
        }
        if (payload.getSuggestedScore() != null) {
            payload.setSuggestedScore(Math.max(0, Math.min(100, payload.getSuggestedScore())));
        }
        return payload;
    }
}
