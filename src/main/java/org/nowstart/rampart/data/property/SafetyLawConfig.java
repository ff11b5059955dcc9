package org.nowstart.rampart.data.property;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rampart.safety")
public record SafetyLawConfig(
        // Tourniquet: stop distances at or beyond this many pips are never opened
        @DefaultValue("30") double maxStopLossPips,
        // Winner: reward/risk ratio that locks the stop at breakeven
        @DefaultValue("2.5") double winnerRewardRiskThreshold,
        // Winner: pips beyond entry (in the trade's favor) for the breakeven stop
        @DefaultValue("1") double breakevenBufferPips,
        // Zombie: bars held without a take-profit fill before tightening starts (0 disables)
        @DefaultValue("40") int zombieStalenessBars,
        // Zombie: pips moved toward entry at each threshold multiple
        @DefaultValue("5") double zombieStepPips,
        // distance kept behind the best price once breakeven is locked (0 disables)
        @DefaultValue("0") double trailingDistancePips
) {

    public SafetyLawConfig {
        requirePositive("maxStopLossPips", maxStopLossPips);
        requirePositive("winnerRewardRiskThreshold", winnerRewardRiskThreshold);
        requireNonNegative("breakevenBufferPips", breakevenBufferPips);
        requireNonNegative("zombieStepPips", zombieStepPips);
        requireNonNegative("trailingDistancePips", trailingDistancePips);
        if (zombieStalenessBars < 0) {
            throw new IllegalArgumentException("zombieStalenessBars must be >= 0");
        }
    }

    public static SafetyLawConfig defaults() {
        return new SafetyLawConfig(30.0, 2.5, 1.0, 40, 5.0, 0.0);
    }

    public SafetyLawConfig withPack(
            double maxStopLossPips,
            double winnerRewardRiskThreshold,
            int zombieStalenessBars,
            double zombieStepPips
    ) {
        return new SafetyLawConfig(
                maxStopLossPips,
                winnerRewardRiskThreshold,
                breakevenBufferPips,
                zombieStalenessBars,
                zombieStepPips,
                trailingDistancePips
        );
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(field + " must be > 0");
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(field + " must be >= 0");
        }
    }
}
