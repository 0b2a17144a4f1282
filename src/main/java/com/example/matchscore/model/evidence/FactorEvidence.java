package com.example.matchscore.model.evidence;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured evidence behind a factor sub-score. One fixed schema per factor type,
 * tagged on the wire by {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IndustryEvidence.class, name = "industry_code"),
        @JsonSubTypes.Type(value = GeographyEvidence.class, name = "geography"),
        @JsonSubTypes.Type(value = CertificationEvidence.class, name = "certification"),
        @JsonSubTypes.Type(value = PastPerformanceEvidence.class, name = "past_performance"),
        @JsonSubTypes.Type(value = ClearanceEvidence.class, name = "security_clearance"),
        @JsonSubTypes.Type(value = GovernmentLevelEvidence.class, name = "government_level"),
        @JsonSubTypes.Type(value = CompetencyEvidence.class, name = "competency"),
        @JsonSubTypes.Type(value = CredibilityEvidence.class, name = "credibility")
})
public interface FactorEvidence {
}
