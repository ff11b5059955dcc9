package org.nowstart.rampart.data.dto;

import java.time.Instant;

public record EquityPoint(
        Instant timestamp,
        double equity,
        double markToMarketEquity,
        double peakEquity,
        double drawdown,
        int openPositions
) {
}
