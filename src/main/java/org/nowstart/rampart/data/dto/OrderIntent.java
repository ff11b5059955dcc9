package org.nowstart.rampart.data.dto;

import java.time.Instant;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.OrderIntentType;

public record OrderIntent(
        OrderIntentType type,
        String instrument,
        String positionId,
        Direction direction,
        double size,
        double price,
        double stopPrice,
        Instant at
) {
}
