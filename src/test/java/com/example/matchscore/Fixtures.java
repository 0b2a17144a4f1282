package com.example.matchscore;

import com.example.matchscore.model.Certification;
import com.example.matchscore.model.GovernmentLevel;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.PastPerformance;
import com.example.matchscore.model.Profile;
import com.example.matchscore.service.scoring.DeterministicScorer;
import com.example.matchscore.service.scoring.RecommendationGenerator;
import com.example.matchscore.service.scoring.factor.CertificationEvaluator;
import com.example.matchscore.service.scoring.factor.CompetencyEvaluator;
import com.example.matchscore.service.scoring.factor.CredibilityEvaluator;
import com.example.matchscore.service.scoring.factor.GeographyEvaluator;
import com.example.matchscore.service.scoring.factor.GovernmentLevelEvaluator;
import com.example.matchscore.service.scoring.factor.IndustryCodeEvaluator;
import com.example.matchscore.service.scoring.factor.PastPerformanceEvaluator;
import com.example.matchscore.service.scoring.factor.SecurityClearanceEvaluator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    public static final String ORG = "org-1";
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {}

    public static DeterministicScorer scorer() {
        return new DeterministicScorer(List.of(
                new PastPerformanceEvaluator(CLOCK),
                new IndustryCodeEvaluator(),
                new CertificationEvaluator(),
                new CompetencyEvaluator(),
                new SecurityClearanceEvaluator(),
                new GeographyEvaluator(),
                new GovernmentLevelEvaluator(),
                new CredibilityEvaluator()),
                new RecommendationGenerator(), CLOCK, "v-test");
    }

    public static Profile profile() {
        Profile p = new Profile();
        p.setId("prof-1");
        p.setOrganizationId(ORG);
        p.setCompanyName("Acme Federal Solutions");
        p.setPrimaryIndustryCode("541511");
        p.setSecondaryIndustryCodes(new ArrayList<>(List.of("541512")));
        p.setState("VA");
        p.setCity("Arlington");
        p.setCertifications(new ArrayList<>(List.of(new Certification("8a", "ACTIVE"))));
        p.setSetAsides(new ArrayList<>(List.of("small_business")));
        p.setGovernmentLevels(new ArrayList<>(List.of(GovernmentLevel.FEDERAL)));
        p.setCapabilityKeywords(new ArrayList<>(List.of("cloud migration", "cybersecurity", "devops")));
        PastPerformance pp = new PastPerformance();
        pp.setDescription("Ten years of federal IT modernization.");
        pp.setProjects(new ArrayList<>(List.of(project("VA EHR support", "Department of Veterans Affairs", "FEDERAL", 2_000_000.0, 2024))));
        p.setPastPerformance(pp);
        p.setSamRegistered(true);
        p.setUei("ABCDEF123456");
        p.setCageCode("1ABC2");
        p.setCompletenessPercentage(90);
        return p;
    }

    /** Only the fields every record has. */
    public static Profile emptyProfile() {
        Profile p = new Profile();
        p.setId("prof-empty");
        p.setOrganizationId(ORG);
        return p;
    }

    public static Opportunity opportunity() {
        Opportunity o = new Opportunity();
        o.setId("opp-1");
        o.setTitle("Cloud migration services");
        o.setAgency("Department of Veterans Affairs");
        o.setIndustryCodes(new ArrayList<>(List.of("541511")));
        o.setState("VA");
        o.setCity("Arlington");
        Opportunity.EstimatedValue v = new Opportunity.EstimatedValue();
        v.setValue(1_500_000.0);
        o.setEstimatedValue(v);
        o.setDescription("The agency requires cloud migration and cybersecurity support for legacy systems.");
        return o;
    }

    public static Opportunity emptyOpportunity() {
        Opportunity o = new Opportunity();
        o.setId("opp-empty");
        return o;
    }

    public static Opportunity opportunity(String id) {
        Opportunity o = opportunity();
        o.setId(id);
        return o;
    }

    public static PastPerformance.PastProject project(String name, String customer, String type, Double value, Integer year) {
        PastPerformance.PastProject p = new PastPerformance.PastProject();
        p.setName(name);
        p.setCustomer(customer);
        p.setCustomerType(type);
        p.setValue(value);
        p.setCompletionYear(year);
        return p;
    }
}
