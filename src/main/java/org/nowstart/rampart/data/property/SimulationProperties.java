package org.nowstart.rampart.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rampart.simulation")
public record SimulationProperties(
        // instrument label used when a request does not name one
        @NotBlank @DefaultValue("EUR_USD") String instrument,
        // price value of one pip
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.0001") double pipSize,
        // starting equity of every run (and of the shared live account)
        @DecimalMin("0") @DefaultValue("100000") double initialEquity,
        // bars of history handed to strategies and regime classifiers
        @Positive @DefaultValue("500") int historyWindow
) {
}
