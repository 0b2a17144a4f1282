package com.example.matchscore.model.evidence;

import com.example.matchscore.model.GovernmentLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GovernmentLevelEvidence implements FactorEvidence {
    private GovernmentLevel opportunityLevel;
    private List<GovernmentLevel> preferredLevels;
}
