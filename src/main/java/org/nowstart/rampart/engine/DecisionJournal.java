package org.nowstart.rampart.engine;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.rampart.data.dto.EngagementEvent;
import org.nowstart.rampart.data.dto.LawEvent;

/**
 * Append-only record of every engagement verdict and every law action for one instrument.
 */
public class DecisionJournal {

    private final List<EngagementEvent> engagementEvents = new ArrayList<>();
    private final List<LawEvent> lawEvents = new ArrayList<>();

    public synchronized void record(EngagementEvent event) {
        engagementEvents.add(event);
    }

    public synchronized void record(LawEvent event) {
        lawEvents.add(event);
    }

    public synchronized List<EngagementEvent> engagementEvents() {
        return List.copyOf(engagementEvents);
    }

    public synchronized List<LawEvent> lawEvents() {
        return List.copyOf(lawEvents);
    }
}
