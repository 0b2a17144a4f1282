package com.example.matchscore.service.enrichment;

import com.example.matchscore.exception.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentResponseParserTest {

    private final EnrichmentResponseParser parser = new EnrichmentResponseParser(new ObjectMapper());

    @Test
    void readsFencedObjectAndIgnoresUnknownFields() {
        EnrichmentPayload p = parser.parse("```json\n{\"strategicInsights\": {\"goNoGoRecommendation\": \"NO_GO\", \"extra\": 1},"
                + " \"suggestedScore\": 140, \"confidence\": \"high\"}\n```");

        assertThat(p.getStrategicInsights().getGoNoGoRecommendation()).isEqualTo("NO_GO");
        assertThat(p.getSemanticAnalysis()).isNull();
        assertThat(p.getSuggestedScore()).isEqualTo(100);
    }

    @Test
    void rejectsRepliesWithoutUsableObject() {
        assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(ProviderException.class);
        assertThatThrownBy(() -> parser.parse("no json here")).isInstanceOf(ProviderException.class);
        assertThatThrownBy(() -> parser.parse("{\"semanticAnalysis\": [1, 2}"))
                .isInstanceOf(ProviderException.class)
                .hasMessageStartingWith("Malformed");
        assertThatThrownBy(() -> parser.parse("{\"suggestedScore\": 50}"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("neither");
    }
}
