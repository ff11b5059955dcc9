package org.nowstart.rampart.data.dto;

import org.nowstart.rampart.data.type.TriageVerdict;

public record TriageDecision(
        TriageVerdict verdict,
        double ladderMultiplier,
        double regimeMultiplier,
        double sizeMultiplier,
        double size,
        String reason
) {

    public static TriageDecision skip(double ladderMultiplier, double regimeMultiplier, String reason) {
        return new TriageDecision(
                TriageVerdict.SKIP,
                ladderMultiplier,
                regimeMultiplier,
                ladderMultiplier * regimeMultiplier,
                0.0,
                reason
        );
    }

    public boolean allowed() {
        return verdict != TriageVerdict.SKIP;
    }
}
