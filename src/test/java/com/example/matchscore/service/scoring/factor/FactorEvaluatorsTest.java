package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.Fixtures;
import com.example.matchscore.model.GovernmentLevel;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.SecurityClearance;
import com.example.matchscore.model.evidence.CompetencyEvidence;
import com.example.matchscore.model.evidence.GovernmentLevelEvidence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FactorEvaluatorsTest {

    @Test
    void geography() {
        GeographyEvaluator g = new GeographyEvaluator();
        Profile p = Fixtures.profile();
        Opportunity o = Fixtures.opportunity();
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(100);

        o.setCity("Richmond");
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(75);

        o.setState("CA");
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(25);

        o.setNationwide(true);
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(50);

        assertThat(g.evaluate(Fixtures.emptyProfile(), Fixtures.opportunity()).getScore()).isEqualTo(40);
    }

    @Test
    void securityClearance() {
        SecurityClearanceEvaluator c = new SecurityClearanceEvaluator();
        Profile p = Fixtures.profile();
        Opportunity o = Fixtures.opportunity();
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(100);

        o.setSecurityClearanceRequired(SecurityClearance.SECRET);
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(10);

        p.setSecurityClearance(SecurityClearance.PUBLIC_TRUST);
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(40);

        p.setSecurityClearance(SecurityClearance.TOP_SECRET);
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(100);
    }

    @Test
    void governmentLevel() {
        GovernmentLevelEvaluator g = new GovernmentLevelEvaluator();
        Profile p = Fixtures.profile();
        Opportunity o = Fixtures.opportunity();
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(100);

        o.setAgency("County of Fairfax");
        assertThat(((GovernmentLevelEvidence) g.evaluate(p, o).getEvidence()).getOpportunityLevel())
                .isEqualTo(GovernmentLevel.LOCAL);
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(40);

        p.setGovernmentLevels(new ArrayList<>(List.of(GovernmentLevel.STATE)));
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(80);

        p.setGovernmentLevels(new ArrayList<>());
        assertThat(g.evaluate(p, o).getScore()).isEqualTo(50);
    }

    @Test
    void competency() {
        CompetencyEvaluator c = new CompetencyEvaluator();
        Profile p = Fixtures.profile();
        Opportunity o = Fixtures.opportunity();
        // 2 of 3 keywords present: 30 + 70 * 2/3
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(77);
        assertThat(((CompetencyEvidence) c.evaluate(p, o).getEvidence()).getMatchedKeywords())
                .containsExactly("cloud migration", "cybersecurity");

        o.setDescription(null);
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(30);
    }

    @Test
    void competencyReadsOnlyTheOpeningOfLongDescriptions() {
        CompetencyEvaluator c = new CompetencyEvaluator();
        Profile p = Fixtures.profile();
        p.setCapabilityKeywords(new ArrayList<>(List.of("devops")));
        Opportunity o = Fixtures.opportunity();
        o.setDescription("x".repeat(CompetencyEvaluator.MAX_TEXT) + " devops");
        assertThat(c.evaluate(p, o).getScore()).isEqualTo(30);
    }

    @Test
    void credibility() {
        CredibilityEvaluator c = new CredibilityEvaluator();
        // 0.67 * 90 + 0.33 * 100
        assertThat(c.evaluate(Fixtures.profile(), Fixtures.opportunity()).getScore()).isEqualTo(93);

        Profile empty = Fixtures.emptyProfile();
        assertThat(c.evaluate(empty, Fixtures.opportunity()).getScore()).isEqualTo(10);
    }
}
