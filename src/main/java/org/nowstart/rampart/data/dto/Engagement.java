package org.nowstart.rampart.data.dto;

import java.util.List;
import org.nowstart.rampart.data.type.Direction;

public record Engagement(
        String id,
        Direction direction,
        double entryPrice,
        double stopLossPips,
        List<TakeProfitLevel> takeProfits,
        double requestedSize
) {

    public Engagement {
        takeProfits = takeProfits == null ? List.of() : List.copyOf(takeProfits);
    }

    public double takeProfitFractionSum() {
        double sum = 0.0;
        for (TakeProfitLevel level : takeProfits) {
            sum += level.fraction();
        }
        return sum;
    }

    public double furthestTakeProfitPips() {
        double furthest = 0.0;
        for (TakeProfitLevel level : takeProfits) {
            furthest = Math.max(furthest, level.distancePips());
        }
        return furthest;
    }
}
