package com.example.matchscore.service.scoring.factor;

import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.SecurityClearance;
import com.example.matchscore.model.evidence.ClearanceEvidence;
import com.example.matchscore.model.score.FactorResult;
import com.example.matchscore.model.score.FactorType;
import org.springframework.stereotype.Component;

@Component
public class SecurityClearanceEvaluator implements FactorEvaluator {

    @Override
    public FactorType type() {
        return FactorType.SECURITY_CLEARANCE;
    }

    @Override
    public FactorResult evaluate(Profile profile, Opportunity opportunity) {
        SecurityClearance required = opportunity.getSecurityClearanceRequired() == null
                ? SecurityClearance.NONE : opportunity.getSecurityClearanceRequired();
        SecurityClearance held = profile.getSecurityClearance() == null
                ? SecurityClearance.NONE : profile.getSecurityClearance();
        ClearanceEvidence evidence = new ClearanceEvidence(required, held);

        if (required == SecurityClearance.NONE) {
            return new FactorResult(type(), 100, "No clearance required", evidence);
        }
        if (held.covers(required)) {
            return new FactorResult(type(), 100, held + " covers required " + required, evidence);
        }
        if (held == SecurityClearance.NONE) {
            return new FactorResult(type(), 10, required + " clearance required; none held", evidence);
        }
        return new FactorResult(type(), 40, held + " is below required " + required, evidence);
    }
}
