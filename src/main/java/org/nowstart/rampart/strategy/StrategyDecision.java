package org.nowstart.rampart.strategy;

import java.util.List;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.StopAmendment;

public record StrategyDecision(
        List<Engagement> engagements,
        List<StopAmendment> stopAmendments
) {

    private static final StrategyDecision NONE = new StrategyDecision(List.of(), List.of());

    public StrategyDecision {
        engagements = engagements == null ? List.of() : List.copyOf(engagements);
        stopAmendments = stopAmendments == null ? List.of() : List.copyOf(stopAmendments);
    }

    public static StrategyDecision none() {
        return NONE;
    }

    public static StrategyDecision of(List<Engagement> engagements) {
        return engagements == null || engagements.isEmpty() ? NONE : new StrategyDecision(engagements, List.of());
    }

    public boolean isEmpty() {
        return engagements.isEmpty() && stopAmendments.isEmpty();
    }
}
