package com.example.matchscore.model.evidence;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PastPerformanceEvidence implements FactorEvidence {
    private int projectCount;
    private int governmentProjectCount;
    private int recentProjectCount;
    private boolean narrativePresent;
    private Double largestPriorValue;
    private Double opportunityValue;
    /** largestPriorValue / opportunityValue, null when either is unknown. */
    private Double valueRatio;
    private boolean mayExceedCapacity;
}
