package org.nowstart.rampart.data.dto;

public record SimulationSummary(
        int barCount,
        int tradeCount,
        int winCount,
        double winRate,
        double netPnl,
        double totalFees,
        double totalSlippage,
        double finalEquity,
        double peakEquity,
        double maxDrawdown,
        int acceptedEngagements,
        int skippedEngagements,
        int rejectedEngagements,
        String range
) {
}
