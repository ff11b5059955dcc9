package org.nowstart.rampart.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.type.MarketRegime;

public record SimulationRequest(
        String instrument,
        @NotEmpty List<@NotNull Bar> bars,
        List<@NotNull @Valid ScheduledEngagement> engagements,
        SafetyLawConfig safety,
        MarketRegime regime
) {

    public SimulationRequest {
        engagements = engagements == null ? List.of() : engagements;
    }
}
