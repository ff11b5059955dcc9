package org.nowstart.rampart.data.dto;

public record ExecutionRejection(
        String instrument,
        String positionId,
        String reason
) {
}
