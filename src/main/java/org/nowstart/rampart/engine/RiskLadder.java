package org.nowstart.rampart.engine;

import java.util.List;
import org.nowstart.rampart.data.property.RiskBrainConfig.LadderTier;

/**
 * Maps drawdown to a sizing multiplier: the tier with the greatest threshold not exceeding the
 * drawdown wins, 1.0 when no tier applies.
 */
public class RiskLadder {

    private final List<LadderTier> tiers;

    public RiskLadder(List<LadderTier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    public double multiplierFor(double drawdown) {
        double resolved = Double.isFinite(drawdown) ? Math.max(0.0, drawdown) : 0.0;
        double multiplier = 1.0;
        for (LadderTier tier : tiers) {
            if (tier.drawdownThreshold() > resolved) {
                break;
            }
            multiplier = tier.multiplier();
        }
        return multiplier;
    }

    public List<LadderTier> tiers() {
        return tiers;
    }
}
