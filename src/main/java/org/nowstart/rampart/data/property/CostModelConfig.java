package org.nowstart.rampart.data.property;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rampart.cost")
public record CostModelConfig(
        // commission charged per unit of size on every closing fill
        @DefaultValue("0") double feePerUnit,
        // flat commission charged on every closing fill
        @DefaultValue("0") double feePerFill,
        // constant slippage in pips per unit of size
        @DefaultValue("0") double slippagePips,
        // extra slippage per unit of size, as a fraction of the bar range
        @DefaultValue("0") double volatilitySlippageFactor
) {

    public CostModelConfig {
        requireNonNegative("feePerUnit", feePerUnit);
        requireNonNegative("feePerFill", feePerFill);
        requireNonNegative("slippagePips", slippagePips);
        requireNonNegative("volatilitySlippageFactor", volatilitySlippageFactor);
    }

    public static CostModelConfig free() {
        return new CostModelConfig(0.0, 0.0, 0.0, 0.0);
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(field + " must be >= 0");
        }
    }
}
