package org.nowstart.rampart.data.exception;

import java.time.Instant;
import lombok.Getter;

/**
 * Raised when a bar feed delivers a malformed, duplicate or out-of-order bar. Fatal to the run.
 */
@Getter
public class FeedIntegrityException extends RuntimeException {

    public static final String CODE = "feed_integrity";

    private final String instrument;
    private final Instant timestamp;

    public FeedIntegrityException(String instrument, Instant timestamp, String message) {
        super(message + " instrument=" + instrument + " ts=" + timestamp);
        this.instrument = instrument;
        this.timestamp = timestamp;
    }
}
