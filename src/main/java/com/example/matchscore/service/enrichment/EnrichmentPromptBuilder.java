package com.example.matchscore.service.enrichment;

import com.example.matchscore.model.Certification;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.score.CategoryScore;
import com.example.matchscore.model.score.MatchScore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class EnrichmentPromptBuilder {

    static final int MAX_DESCRIPTION = 6_000;

    private static final String OUTPUT_SCHEMA =
            "{\n" +
            "  \"semanticAnalysis\": {\n" +
            "    \"implicitRequirements\": [\"string\"],\n" +
            "    \"hiddenPreferences\": [\"string\"],\n" +
            "    \"evaluationCriteriaPrediction\": [{\"criterion\": \"string\", \"estimatedWeight\": 0, \"evidence\": \"string\"}],\n" +
            "    \"competitiveLandscape\": {\n" +
            "      \"likelyIncumbent\": \"string or null\",\n" +
            "      \"estimatedCompetitors\": 0,\n" +
            "      \"competitorProfiles\": [\"string\"],\n" +
            "      \"incumbentVulnerabilities\": [\"string\"]\n" +
            "    }\n" +
            "  },\n" +
            "  \"strategicInsights\": {\n" +
            "    \"winProbability\": {\"percentage\": 0, \"rationale\": \"string\", \"low\": 0, \"high\": 0},\n" +
            "    \"competitiveAdvantages\": [{\"advantage\": \"string\", \"impact\": \"HIGH|MEDIUM|LOW\", \"howToLeverage\": \"string\"}],\n" +
            "    \"criticalGaps\": [{\"gap\": \"string\", \"severity\": \"DISQUALIFYING|CRITICAL|IMPORTANT|MINOR\", \"mitigation\": \"string\"}],\n" +
            "    \"teamingRecommendations\": [{\"partnerType\": \"string\", \"reason\": \"string\", \"urgency\": \"IMMEDIATE|SOON|EVENTUAL\"}],\n" +
            "    \"goNoGoRecommendation\": \"STRONG_GO|GO|CONDITIONAL_GO|NO_GO\",\n" +
            "    \"decisionRationale\": \"string\"\n" +
            "  },\n" +
            "  \"suggestedScore\": 0,\n" +
            "  \"scoreRationale\": \"string\"\n" +
            "}";

    private final ObjectMapper mapper;

    public EnrichmentPromptBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String build(Profile profile, Opportunity opportunity, MatchScore base) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("opportunity", opportunityContext(opportunity));
        context.put("company", profileContext(profile));
        context.put("deterministicScore", scoreContext(base));

        String json;
        try {
            json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize prompt context", e);
        }

        return "You are an expert government contracting capture analyst. Analyze how well the company fits "
                + "the opportunity below. A deterministic model has already scored the pair; use it as a baseline, "
                + "look for implicit requirements and competitive dynamics it cannot see, and suggest an overall "
                + "score from 0 to 100.\n\n"
                + "CONTEXT:\n" + json + "\n\n"
                + "Respond with a single JSON object and nothing else, matching this structure:\n"
                + OUTPUT_SCHEMA + "\n";
    }

    private static Map<String, Object> opportunityContext(Opportunity o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("title", o.getTitle());
        m.put("agency", o.getAgency());
        m.put("industryCodes", o.getIndustryCodes());
        m.put("placeOfPerformance", o.isNationwide() ? "nationwide" : join(o.getCity(), o.getState()));
        m.put("estimatedValue", o.getEstimatedValue() == null ? null : o.getEstimatedValue().resolve());
        m.put("responseDeadline", o.getResponseDeadline() == null ? null : o.getResponseDeadline().toString());
        m.put("setAside", o.getSetAsideType());
        m.put("requiredCertifications", o.getRequiredCertifications());
        m.put("securityClearanceRequired", o.getSecurityClearanceRequired());
        String d = o.getDescription();
        if (d != null && d.length() > MAX_DESCRIPTION) d = d.substring(0, MAX_DESCRIPTION);
        m.put("description", d);
        return m;
    }

    private static Map<String, Object> profileContext(Profile p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("companyName", p.getCompanyName());
        m.put("primaryIndustryCode", p.getPrimaryIndustryCode());
        m.put("secondaryIndustryCodes", p.getSecondaryIndustryCodes());
        m.put("location", join(p.getCity(), p.getState()));
        List<String> certs = new ArrayList<>();
        if (p.getCertifications() != null) {
            for (Certification c : p.getCertifications()) {
                if (c != null && c.isActive()) certs.add(c.getType());
            }
        }
        m.put("certifications", certs);
        m.put("setAsides", p.getSetAsides());
        m.put("securityClearance", p.getSecurityClearance());
        m.put("governmentLevels", p.getGovernmentLevels());
        m.put("capabilityKeywords", p.getCapabilityKeywords());
        if (p.getPastPerformance() != null) {
            m.put("pastPerformanceSummary", p.getPastPerformance().getDescription());
            m.put("pastProjectCount", p.getPastPerformance().getProjects() == null ? 0 : p.getPastPerformance().getProjects().size());
        }
        m.put("samRegistered", p.isSamRegistered());
        return m;
    }

    private static Map<String, Object> scoreContext(MatchScore base) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("overall", base.getOverallScore());
        for (CategoryScore c : base.categories()) {
            m.put(c.getCategory().value(), c.getScore() + " (" + c.getDetails() + ")");
        }
        return m;
    }

    private static String join(String city, String state) {
        if (city == null || city.isBlank()) return state;
        if (state == null || state.isBlank()) return city;
        return city + ", " + state;
    }
}
