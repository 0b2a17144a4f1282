package com.example.matchscore.model.evidence;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class IndustryEvidence implements FactorEvidence {

    public enum MatchLevel { EXACT_PRIMARY, SECONDARY, INDUSTRY_GROUP, SECTOR, NONE, NO_DATA }

    private MatchLevel matchLevel;
    private String profilePrimaryCode;
    /** Opportunity code that produced the match, null when nothing matched. */
    private String matchedCode;
    private List<String> opportunityCodes;
}
