package org.nowstart.rampart.data.dto;

import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.PositionState;

public record PositionSnapshot(
        String positionId,
        String engagementId,
        Direction direction,
        PositionState state,
        double entryPrice,
        double stopPrice,
        double initialSize,
        double remainingSize,
        boolean breakevenLocked,
        boolean trailing,
        int barsHeld,
        int takeProfitsFilled,
        double unrealizedPnl
) {
}
