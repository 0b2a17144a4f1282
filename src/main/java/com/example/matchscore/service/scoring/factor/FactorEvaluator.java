package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;

/**
 * Scores one dimension of a profile/opportunity pair. Implementations are pure and total:
 * missing optional data yields a low, non-zero score rather than an exception.
 */
public interface FactorEvaluator {

    FactorType type();

    FactorResult evaluate(Profile profile, Opportunity opportunity);
}
