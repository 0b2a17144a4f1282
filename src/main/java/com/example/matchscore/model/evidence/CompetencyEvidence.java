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
public class CompetencyEvidence implements FactorEvidence {
    private int keywordsConsidered;
    private List<String> matchedKeywords;
}
