package org.nowstart.rampart.feed;

import java.util.List;
import java.util.Optional;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.exception.FeedIntegrityException;

/**
 * Finite feed over an in-memory bar list. Bars are delivered exactly as given; ordering is checked downstream.
 */
public class ListBarFeed implements BarFeed {

    private final String instrument;
    private final List<Bar> bars;
    private int cursor;

    public ListBarFeed(String instrument, List<Bar> bars) {
        this.instrument = instrument;
        this.bars = bars == null ? List.of() : bars;
    }

    @Override
    public String instrument() {
        return instrument;
    }

    @Override
    public Optional<Bar> next() {
        if (cursor >= bars.size()) {
            return Optional.empty();
        }
        Bar bar = bars.get(cursor++);
        if (bar == null) {
            throw new FeedIntegrityException(instrument, null, "null bar at index " + (cursor - 1));
        }
        return Optional.of(bar);
    }
}
