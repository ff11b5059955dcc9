package org.nowstart.rampart.data.dto;

import java.util.List;

public record SimulationResult(
        String instrument,
        List<ClosedTrade> trades,
        List<EquityPoint> equityCurve,
        AccountSnapshot finalAccount,
        List<EngagementEvent> engagementEvents,
        List<LawEvent> lawEvents,
        SimulationSummary summary
) {
}
