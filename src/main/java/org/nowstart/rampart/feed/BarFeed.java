package org.nowstart.rampart.feed;

import java.util.Optional;
import org.nowstart.rampart.data.dto.Bar;

/**
 * Pull-based bar source for one instrument. {@link Optional#empty()} is the end-of-stream signal and is
 * returned only once the feed is exhausted or closed, never for a stall; live implementations block instead.
 */
public interface BarFeed {

    String instrument();

    Optional<Bar> next() throws InterruptedException;
}
