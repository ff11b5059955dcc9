package org.nowstart.rampart.data.dto;

import java.time.Instant;
import org.nowstart.rampart.data.type.LawAction;
import org.nowstart.rampart.data.type.SafetyLaw;

public record LawEvent(
        Instant timestamp,
        String instrument,
        String positionId,
        SafetyLaw law,
        LawAction action,
        double previousStopPrice,
        double newStopPrice,
        String detail
) {
}
