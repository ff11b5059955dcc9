package org.nowstart.rampart.strategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.ScheduledEngagement;

/**
 * Replays a fixed engagement sequence. Each engagement is proposed on the first bar whose timestamp is at or
 * after its scheduled instant; entries scheduled before the first bar go out on that bar. Entries without an
 * instant or an engagement are dropped up front so one bad row cannot abort the run.
 */
@Slf4j
public class ScheduledEngagementStrategy implements Strategy {

    private final List<ScheduledEngagement> schedule;
    private int cursor;

    public ScheduledEngagementStrategy(List<ScheduledEngagement> schedule) {
        List<ScheduledEngagement> sorted = new ArrayList<>();
        if (schedule != null) {
            for (int i = 0; i < schedule.size(); i++) {
                ScheduledEngagement entry = schedule.get(i);
                if (entry == null || entry.at() == null || entry.engagement() == null) {
                    log.warn("event=scheduled_engagement_dropped index={} entry={}", i, entry);
                    continue;
                }
                sorted.add(entry);
            }
        }
        // stable: engagements sharing an instant keep their submitted order
        sorted.sort(Comparator.comparing(ScheduledEngagement::at));
        this.schedule = List.copyOf(sorted);
    }

    @Override
    public StrategyDecision decide(StrategyContext context) {
        List<Engagement> due = new ArrayList<>();
        while (cursor < schedule.size() && !schedule.get(cursor).at().isAfter(context.bar().timestamp())) {
            due.add(schedule.get(cursor).engagement());
            cursor++;
        }
        return StrategyDecision.of(due);
    }

    public int scheduled() {
        return schedule.size();
    }

    public int remaining() {
        return schedule.size() - cursor;
    }
}
