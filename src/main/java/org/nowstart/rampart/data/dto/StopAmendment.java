package org.nowstart.rampart.data.dto;

public record StopAmendment(
        String positionId,
        double newStopPrice
) {
}
