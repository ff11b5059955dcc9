package org.nowstart.rampart.feed;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;

/**
 * Unbounded-in-time feed backed by a bounded blocking queue. A consumer waiting on an empty queue is stalled,
 * not finished; end-of-stream is signalled only by {@link #end()}, after which already queued bars are still
 * delivered.
 */
@Slf4j
public class LiveBarFeed implements BarFeed {

    private static final Bar END_OF_STREAM = new Bar(Instant.EPOCH, 0.0, 0.0, 0.0, 0.0, 0.0);
    private static final long POLL_MILLIS = 250L;

    private final String instrument;
    private final BlockingQueue<Bar> queue;
    private volatile boolean ended;

    public LiveBarFeed(String instrument, int capacity) {
        this.instrument = instrument;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public String instrument() {
        return instrument;
    }

    /**
     * @return false when the feed has ended or the queue stayed full for the whole timeout
     */
    public boolean publish(Bar bar, long timeout, TimeUnit unit) throws InterruptedException {
        if (bar == null) {
            throw new IllegalArgumentException("bar is required");
        }
        if (ended) {
            return false;
        }
        boolean offered = queue.offer(bar, timeout, unit);
        if (!offered) {
            log.warn("event=live_feed_full instrument={} capacity_remaining={}", instrument, queue.remainingCapacity());
        }
        return offered;
    }

    public void end() {
        if (ended) {
            return;
        }
        ended = true;
        // the marker may not fit when the queue is full; the ended flag covers that case once it drains
        queue.offer(END_OF_STREAM);
    }

    public boolean isEnded() {
        return ended;
    }

    public int backlog() {
        return queue.size();
    }

    @Override
    public Optional<Bar> next() throws InterruptedException {
        while (true) {
            Bar bar = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (bar == END_OF_STREAM) {
                return Optional.empty();
            }
            if (bar != null) {
                return Optional.of(bar);
            }
            if (ended && queue.isEmpty()) {
                return Optional.empty();
            }
        }
    }
}
