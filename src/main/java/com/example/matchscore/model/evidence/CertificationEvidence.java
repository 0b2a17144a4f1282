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
public class CertificationEvidence implements FactorEvidence {
    private String requiredSetAside;
    private List<String> requiredCertifications;
    /** Profile certifications and set-aside flags that satisfy the requirement. */
    private List<String> matchedSources;
    private boolean eligible;
}
