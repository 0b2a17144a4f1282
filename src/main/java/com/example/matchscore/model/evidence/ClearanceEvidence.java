package com.example.matchscore.model.evidence;

import com.example.matchscore.model.SecurityClearance;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ClearanceEvidence implements FactorEvidence {
    private SecurityClearance required;
    private SecurityClearance held;
}
