package org.nowstart.rampart.data.dto;

import org.nowstart.rampart.data.property.SafetyLawConfig;

public record PackResult(
        SafetyLawConfig safety,
        double pnlToDrawdown,
        double netPnl,
        double maxDrawdown,
        double finalEquity,
        int tradeCount
) {
}
