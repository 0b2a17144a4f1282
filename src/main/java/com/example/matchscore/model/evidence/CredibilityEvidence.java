package com.example.matchscore.model.evidence;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CredibilityEvidence implements FactorEvidence {
    private int completeness;
    private boolean samRegistered;
    private boolean hasUei;
    private boolean hasCage;
    private int registrationReadiness;
}
