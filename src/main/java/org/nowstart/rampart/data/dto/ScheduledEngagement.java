package org.nowstart.rampart.data.dto;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * An engagement proposed on the first bar whose timestamp is at or after {@code at}.
 */
public record ScheduledEngagement(
        @NotNull Instant at,
        @NotNull Engagement engagement
) {
}
