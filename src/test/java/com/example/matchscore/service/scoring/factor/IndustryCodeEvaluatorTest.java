package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.Fixtures;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.evidence.IndustryEvidence;
import com.example.matchscore.model.score.FactorResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndustryCodeEvaluatorTest {

    private final IndustryCodeEvaluator evaluator = new IndustryCodeEvaluator();

    private FactorResult evaluate(String... codes) {
        Opportunity o = Fixtures.opportunity();
        o.setIndustryCodes(List.of(codes));
        return evaluator.evaluate(Fixtures.profile(), o);
    }

    @Test
    void exactPrimaryMatchScoresHighest() {
        FactorResult r = evaluate("541511");
        assertThat(r.getScore()).isEqualTo(100);
        assertThat(((IndustryEvidence) r.getEvidence()).getMatchLevel()).isEqualTo(IndustryEvidence.MatchLevel.EXACT_PRIMARY);
        assertThat(((IndustryEvidence) r.getEvidence()).getMatchedCode()).isEqualTo("541511");
    }

    @Test
    void matchLevelsStepDown() {
        assertThat(evaluate("541512").getScore()).isEqualTo(80);
        assertThat(evaluate("541519").getScore()).isEqualTo(60);
        assertThat(evaluate("541330").getScore()).isEqualTo(40);
        assertThat(evaluate("999999").getScore()).isEqualTo(5);
    }

    @Test
    void bestOfSeveralOpportunityCodesWins() {
        assertThat(evaluate("999999", "541330", "541512").getScore()).isEqualTo(80);
    }

    @Test
    void missingCodesGiveLowNonZeroScore() {
        Profile p = Fixtures.emptyProfile();
        FactorResult r = evaluator.evaluate(p, Fixtures.opportunity());
        assertThat(r.getScore()).isEqualTo(10);
        assertThat(r.getDataAvailability()).isZero();
        assertThat(((IndustryEvidence) r.getEvidence()).getMatchLevel()).isEqualTo(IndustryEvidence.MatchLevel.NO_DATA);

        assertThat(evaluate().getScore()).isEqualTo(10);
    }
}
