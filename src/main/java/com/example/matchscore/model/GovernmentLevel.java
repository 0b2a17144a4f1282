package com.example.matchscore.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Locale;

@Schema(description = "Level of government an agency belongs to")
public enum GovernmentLevel {
    FEDERAL,
    STATE,
    LOCAL;

    private static final List<String> FEDERAL_KEYWORDS = List.of(
            "department of", "dept of", "dod", "defense", "gsa", "general services",
            "homeland security", "dhs", "veterans affairs", "health and human services",
            "hhs", "treasury", "commerce", "epa", "environmental protection", "nasa",
            "national aeronautics", "sba", "small business administration", "agriculture",
            "usda", "education", "federal", "national");
    private static final List<String> STATE_KEYWORDS = List.of("state of", "state");
    private static final List<String> LOCAL_KEYWORDS = List.of(
            "city", "county", "municipal", "town", "village", "district");

    /** Unknown agencies are treated as federal. */
    public static GovernmentLevel ofAgency(String agency) {
        if (agency == null || agency.isBlank()) return FEDERAL;
        String a = agency.toLowerCase(Locale.ROOT);
        for (String k : FEDERAL_KEYWORDS) if (a.contains(k)) return FEDERAL;
        for (String k : STATE_KEYWORDS) if (a.contains(k)) return STATE;
        for (String k : LOCAL_KEYWORDS) if (a.contains(k)) return LOCAL;
        return FEDERAL;
    }

    public int compatibilityWith(GovernmentLevel opportunityLevel) {
        if (this == opportunityLevel) return 100;
        if (this == FEDERAL) return opportunityLevel == STATE ? 60 : 40;
        if (this == STATE) return opportunityLevel == FEDERAL ? 60 : 80;
        return opportunityLevel == STATE ? 80 : 30;
    }
}
