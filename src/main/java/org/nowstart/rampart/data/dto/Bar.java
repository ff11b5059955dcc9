package org.nowstart.rampart.data.dto;

import java.time.Instant;

public record Bar(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public double range() {
        return high - low;
    }
}
