package com.example.matchscore.model.evidence;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GeographyEvidence implements FactorEvidence {
    private String profileState;
    private String opportunityState;
    private boolean nationwide;
    private boolean sameState;
    private boolean sameCity;
}
