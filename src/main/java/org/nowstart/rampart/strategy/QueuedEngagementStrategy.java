package org.nowstart.rampart.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.StopAmendment;

/**
 * Live strategy adapter. Engagements and stop amendments submitted from other threads are handed to the
 * worker on its next bar.
 */
public class QueuedEngagementStrategy implements Strategy {

    private final ConcurrentLinkedQueue<Engagement> engagements = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<StopAmendment> amendments = new ConcurrentLinkedQueue<>();

    public void enqueue(Engagement engagement) {
        engagements.add(engagement);
    }

    public void enqueue(StopAmendment amendment) {
        amendments.add(amendment);
    }

    public int pending() {
        return engagements.size() + amendments.size();
    }

    @Override
    public StrategyDecision decide(StrategyContext context) {
        List<Engagement> drainedEngagements = new ArrayList<>();
        Engagement engagement;
        while ((engagement = engagements.poll()) != null) {
            drainedEngagements.add(engagement);
        }
        List<StopAmendment> drainedAmendments = new ArrayList<>();
        StopAmendment amendment;
        while ((amendment = amendments.poll()) != null) {
            drainedAmendments.add(amendment);
        }
        if (drainedEngagements.isEmpty() && drainedAmendments.isEmpty()) {
            return StrategyDecision.none();
        }
        return new StrategyDecision(drainedEngagements, drainedAmendments);
    }
}
