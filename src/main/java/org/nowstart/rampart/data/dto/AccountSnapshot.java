package org.nowstart.rampart.data.dto;

import java.time.LocalDate;

/**
 * Committed account values. Readers always see a complete snapshot, never a half-applied update.
 */
public record AccountSnapshot(
        double equity,
        double peakEquity,
        LocalDate tradingDay,
        double dayStartEquity
) {

    private static final double MAX_DRAWDOWN = Math.nextDown(1.0);

    public double drawdown() {
        if (!Double.isFinite(peakEquity) || peakEquity <= 0.0) {
            return 0.0;
        }
        double drawdown = (peakEquity - equity) / peakEquity;
        if (!Double.isFinite(drawdown) || drawdown <= 0.0) {
            return 0.0;
        }
        return Math.min(drawdown, MAX_DRAWDOWN);
    }

    public double dailyLoss() {
        if (!Double.isFinite(dayStartEquity) || dayStartEquity <= 0.0) {
            return 0.0;
        }
        double loss = (dayStartEquity - equity) / dayStartEquity;
        return Double.isFinite(loss) && loss > 0.0 ? loss : 0.0;
    }
}
