package org.nowstart.rampart.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.nowstart.rampart.data.type.ExecutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rampart.router")
public record RouterProperties(
        // execution sink used by the live router
        @NotNull @DefaultValue("PAPER") ExecutionMode executionMode,
        // instruments accepted by the live router
        @NotNull @DefaultValue("EUR_USD") List<String> instruments,
        // bars buffered per instrument before publishers block
        @Positive @DefaultValue("1024") int feedCapacity,
        // wait for in-flight force-closes when stopping
        @NotNull @DefaultValue("10s") Duration shutdownTimeout,
        // status log interval
        @NotNull @DefaultValue("60s") Duration heartbeatInterval,
        // paper orders with a larger notional are rejected (0 disables)
        @DecimalMin("0") @DefaultValue("0") double maxOrderNotional
) {
}
