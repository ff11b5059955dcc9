package org.nowstart.rampart.data.dto;

import java.time.Instant;
import org.nowstart.rampart.data.type.EngagementStatus;
import org.nowstart.rampart.data.type.SafetyLaw;

public record EngagementEvent(
        Instant timestamp,
        String instrument,
        String engagementId,
        EngagementStatus status,
        SafetyLaw law,
        String reason,
        double requestedSize,
        double acceptedSize,
        String positionId
) {

    public boolean accepted() {
        return status == EngagementStatus.ACCEPTED;
    }
}
