package org.nowstart.rampart.data.dto;

public record InstrumentStatus(
        String instrument,
        boolean active,
        long barsProcessed,
        int openPositions,
        int closedTrades,
        String lastError
) {
}
