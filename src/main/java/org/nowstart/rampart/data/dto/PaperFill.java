package org.nowstart.rampart.data.dto;

import java.time.Instant;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.OrderIntentType;

public record PaperFill(
        String instrument,
        String positionId,
        OrderIntentType type,
        Direction direction,
        double size,
        double price,
        Instant at
) {
}
