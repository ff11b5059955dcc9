package org.nowstart.rampart.data.dto;

import java.time.Instant;
import org.nowstart.rampart.data.type.CloseReason;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.SafetyLaw;

public record ClosedTrade(
        String positionId,
        String engagementId,
        String instrument,
        Direction direction,
        double entryPrice,
        double exitPrice,
        double totalSize,
        double grossPnl,
        double fees,
        double slippage,
        double realizedPnl,
        CloseReason closeReason,
        SafetyLaw triggeringLaw,
        int barsHeld,
        int takeProfitsFilled,
        Instant openedAt,
        Instant closedAt
) {

    public boolean isWin() {
        return realizedPnl > 0.0;
    }
}
