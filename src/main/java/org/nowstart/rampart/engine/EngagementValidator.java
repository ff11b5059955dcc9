package org.nowstart.rampart.engine;

import java.util.Optional;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.TakeProfitLevel;

/**
 * Structural checks applied before an engagement reaches the risk brain.
 */
public final class EngagementValidator {

    private static final double FRACTION_TOLERANCE = 1e-9;

    private EngagementValidator() {
    }

    /**
     * @return the rejection reason, or empty when the engagement is well formed
     */
    public static Optional<String> validate(Engagement engagement) {
        if (engagement == null) {
            return Optional.of("engagement is required");
        }
        if (engagement.id() == null || engagement.id().isBlank()) {
            return Optional.of("engagement id is required");
        }
        if (engagement.direction() == null) {
            return Optional.of("direction is required");
        }
        if (!Double.isFinite(engagement.entryPrice()) || engagement.entryPrice() <= 0.0) {
            return Optional.of("entry price must be > 0");
        }
        if (!Double.isFinite(engagement.requestedSize()) || engagement.requestedSize() <= 0.0) {
            return Optional.of("requested size must be > 0");
        }
        if (!Double.isFinite(engagement.stopLossPips()) || engagement.stopLossPips() <= 0.0) {
            return Optional.of("zero risk distance");
        }
        if (engagement.takeProfits().isEmpty()) {
            return Optional.of("at least one take-profit level is required");
        }
        for (TakeProfitLevel level : engagement.takeProfits()) {
            if (level == null) {
                return Optional.of("take-profit level is required");
            }
            if (!Double.isFinite(level.distancePips()) || level.distancePips() <= 0.0) {
                return Optional.of("take-profit distance must be > 0");
            }
            if (!Double.isFinite(level.fraction()) || level.fraction() <= 0.0 || level.fraction() > 1.0) {
                return Optional.of("take-profit fraction must be in (0, 1]");
            }
        }
        if (engagement.takeProfitFractionSum() > 1.0 + FRACTION_TOLERANCE) {
            return Optional.of("take-profit fractions exceed 1");
        }
        return Optional.empty();
    }
}
