package org.nowstart.rampart.strategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.nowstart.rampart.data.dto.Bar;

/**
 * Bounded, oldest-first window of recent bars.
 */
public class BarHistory {

    private final int capacity;
    private final List<Bar> bars = new ArrayList<>();

    public BarHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    public void append(Bar bar) {
        bars.add(bar);
        if (bars.size() >= capacity * 2) {
            bars.subList(0, bars.size() - capacity).clear();
        }
    }

    public List<Bar> view() {
        int from = Math.max(0, bars.size() - capacity);
        return Collections.unmodifiableList(new ArrayList<>(bars.subList(from, bars.size())));
    }

    public int size() {
        return Math.min(bars.size(), capacity);
    }
}
