package org.nowstart.rampart.data.property;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.rampart.data.type.MarketRegime;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rampart.risk")
public record RiskBrainConfig(
        // drawdown ladder, thresholds as fractions of peak equity
        List<LadderTier> ladder,
        // sizing multiplier per regime label; missing labels fall back to the defaults
        Map<MarketRegime, Double> regimeMultipliers,
        // engagements whose combined multiplier falls below this are skipped
        @DefaultValue("0.2") double skipFloor,
        // concurrent open positions per lifecycle (0 disables)
        @DefaultValue("5") int maxOpenPositions,
        // loss since the start of the UTC day that halts new engagements (0 disables)
        @DefaultValue("0.05") double maxDailyLossFraction,
        // furthest take-profit distance / stop distance required (0 disables)
        @DefaultValue("0") double minRewardRisk,
        // smallest notional (scaled size x entry) worth opening (0 disables)
        @DefaultValue("0") double minNotional,
        // open notional / equity allowed once the new position is added (0 disables)
        @DefaultValue("0") double maxMarginUtilization
) {

    public static final List<LadderTier> DEFAULT_LADDER = List.of(
            new LadderTier(0.0, 1.0),
            new LadderTier(0.05, 0.75),
            new LadderTier(0.10, 0.5),
            new LadderTier(0.20, 0.25)
    );

    public static final Map<MarketRegime, Double> DEFAULT_REGIME_MULTIPLIERS = Map.of(
            MarketRegime.BULL, 1.0,
            MarketRegime.BEAR, 0.75,
            MarketRegime.SIDEWAYS, 0.6,
            MarketRegime.CRASH, 0.25,
            MarketRegime.TRIAGE, 0.5
    );

    public RiskBrainConfig {
        ladder = normalizeLadder(ladder);
        regimeMultipliers = mergeRegimeMultipliers(regimeMultipliers);
        if (!Double.isFinite(skipFloor) || skipFloor < 0.0 || skipFloor > 1.0) {
            throw new IllegalArgumentException("skipFloor must be in [0, 1]");
        }
        if (maxOpenPositions < 0) {
            throw new IllegalArgumentException("maxOpenPositions must be >= 0");
        }
        if (!Double.isFinite(maxDailyLossFraction) || maxDailyLossFraction < 0.0 || maxDailyLossFraction >= 1.0) {
            throw new IllegalArgumentException("maxDailyLossFraction must be in [0, 1)");
        }
        if (!Double.isFinite(minRewardRisk) || minRewardRisk < 0.0) {
            throw new IllegalArgumentException("minRewardRisk must be >= 0");
        }
        if (!Double.isFinite(minNotional) || minNotional < 0.0) {
            throw new IllegalArgumentException("minNotional must be >= 0");
        }
        if (!Double.isFinite(maxMarginUtilization) || maxMarginUtilization < 0.0) {
            throw new IllegalArgumentException("maxMarginUtilization must be >= 0");
        }
    }

    public static RiskBrainConfig defaults() {
        return new RiskBrainConfig(null, null, 0.2, 5, 0.05, 0.0, 0.0, 0.0);
    }

    private static List<LadderTier> normalizeLadder(List<LadderTier> raw) {
        if (raw == null || raw.isEmpty()) {
            return DEFAULT_LADDER;
        }
        List<LadderTier> sorted = new ArrayList<>(raw);
        sorted.sort(Comparator.comparingDouble(LadderTier::drawdownThreshold));
        double previousThreshold = Double.NEGATIVE_INFINITY;
        double previousMultiplier = Double.POSITIVE_INFINITY;
        for (LadderTier tier : sorted) {
            if (tier.drawdownThreshold() == previousThreshold) {
                throw new IllegalArgumentException("duplicate ladder threshold: " + tier.drawdownThreshold());
            }
            if (tier.multiplier() > previousMultiplier) {
                throw new IllegalArgumentException("ladder multipliers must not increase with drawdown");
            }
            previousThreshold = tier.drawdownThreshold();
            previousMultiplier = tier.multiplier();
        }
        return List.copyOf(sorted);
    }

    private static Map<MarketRegime, Double> mergeRegimeMultipliers(Map<MarketRegime, Double> raw) {
        Map<MarketRegime, Double> merged = new EnumMap<>(MarketRegime.class);
        merged.putAll(DEFAULT_REGIME_MULTIPLIERS);
        if (raw != null) {
            raw.forEach((regime, multiplier) -> {
                if (regime == null || multiplier == null || !Double.isFinite(multiplier) || multiplier < 0.0) {
                    throw new IllegalArgumentException("regime multiplier must be >= 0 for " + regime);
                }
                merged.put(regime, multiplier);
            });
        }
        return Map.copyOf(merged);
    }

    public record LadderTier(
            double drawdownThreshold,
            double multiplier
    ) {

        public LadderTier {
            if (!Double.isFinite(drawdownThreshold) || drawdownThreshold < 0.0 || drawdownThreshold >= 1.0) {
                throw new IllegalArgumentException("drawdownThreshold must be in [0, 1)");
            }
            if (!Double.isFinite(multiplier) || multiplier < 0.0) {
                throw new IllegalArgumentException("multiplier must be >= 0");
            }
        }
    }
}
