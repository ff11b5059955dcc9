package org.nowstart.rampart.engine;

import java.time.Instant;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.exception.FeedIntegrityException;

/**
 * Rejects malformed bars and enforces strictly increasing timestamps for one instrument.
 */
public class BarSequenceGuard {

    private final String instrument;
    private Instant lastTimestamp;

    public BarSequenceGuard(String instrument) {
        this.instrument = instrument;
    }

    public void accept(Bar bar) {
        if (bar == null) {
            throw new FeedIntegrityException(instrument, lastTimestamp, "null bar");
        }
        Instant ts = bar.timestamp();
        if (ts == null) {
            throw new FeedIntegrityException(instrument, null, "bar timestamp is required");
        }
        if (!finitePositive(bar.open()) || !finitePositive(bar.high())
                || !finitePositive(bar.low()) || !finitePositive(bar.close())) {
            throw new FeedIntegrityException(instrument, ts, "bar prices must be finite and > 0");
        }
        if (bar.high() < bar.low()) {
            throw new FeedIntegrityException(instrument, ts, "bar high below low");
        }
        if (outside(bar.open(), bar) || outside(bar.close(), bar)) {
            throw new FeedIntegrityException(instrument, ts, "bar open/close outside high-low range");
        }
        if (!Double.isFinite(bar.volume()) || bar.volume() < 0.0) {
            throw new FeedIntegrityException(instrument, ts, "bar volume must be >= 0");
        }
        if (lastTimestamp != null && !ts.isAfter(lastTimestamp)) {
            String kind = ts.equals(lastTimestamp) ? "duplicate bar timestamp" : "out-of-order bar timestamp";
            throw new FeedIntegrityException(instrument, ts, kind + " previous=" + lastTimestamp);
        }
        lastTimestamp = ts;
    }

    public Instant lastTimestamp() {
        return lastTimestamp;
    }

    private static boolean finitePositive(double value) {
        return Double.isFinite(value) && value > 0.0;
    }

    private static boolean outside(double price, Bar bar) {
        return price > bar.high() || price < bar.low();
    }
}
