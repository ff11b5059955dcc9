package org.nowstart.rampart.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rampart.regime")
public record RegimeProperties(
        // EMA length of the regime anchor
        @Positive @DefaultValue("50") int emaLength,
        // band around the anchor inside which the market is sideways
        @DecimalMin("0") @DecimalMax("0.999999") @DefaultValue("0.01") double band,
        // ATR period for the crash detector
        @Positive @DefaultValue("14") int atrPeriod,
        // ATR / close ratio above which a bearish market is labelled a crash
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.03") double crashAtrRatio
) {
}
