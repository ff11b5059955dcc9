package org.nowstart.rampart.service;

import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.InstrumentStatus;
import org.nowstart.rampart.engine.InstrumentSession;
import org.nowstart.rampart.feed.LiveBarFeed;
import org.nowstart.rampart.strategy.QueuedEngagementStrategy;

/**
 * Drives one instrument's session from its live feed until end-of-stream, then force-closes what is left.
 * A failure inside the session halts this instrument only.
 */
@Slf4j
class InstrumentWorker implements Runnable {

    private final LiveBarFeed feed;
    private final QueuedEngagementStrategy strategy;
    private final InstrumentSession session;

    private volatile boolean active = true;
    private volatile String lastError;
    private volatile long barsProcessed;
    private volatile int openPositions;
    private volatile int closedTrades;

    InstrumentWorker(LiveBarFeed feed, QueuedEngagementStrategy strategy, InstrumentSession session) {
        this.feed = feed;
        this.strategy = strategy;
        this.session = session;
    }

    @Override
    public void run() {
        String instrument = feed.instrument();
        log.info("event=instrument_worker_started instrument={}", instrument);
        try {
            Optional<Bar> next;
            while ((next = feed.next()).isPresent()) {
                session.step(next.get());
                publishCounters();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError = "interrupted";
            log.warn("event=instrument_worker_interrupted instrument={}", instrument);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("event=instrument_worker_failed instrument={} bars_processed={}", instrument, barsProcessed, e);
        } finally {
            feed.end();
            int forced = session.finish().size();
            publishCounters();
            active = false;
            log.info(
                    "event=instrument_worker_stopped instrument={} bars_processed={} force_closed={} closed_trades={}",
                    instrument,
                    barsProcessed,
                    forced,
                    closedTrades
            );
        }
    }

    LiveBarFeed feed() {
        return feed;
    }

    QueuedEngagementStrategy strategy() {
        return strategy;
    }

    boolean isActive() {
        return active;
    }

    InstrumentStatus status() {
        return new InstrumentStatus(feed.instrument(), active, barsProcessed, openPositions, closedTrades, lastError);
    }

    private void publishCounters() {
        barsProcessed = session.getBarsProcessed();
        openPositions = session.lifecycle().openPositionCount();
        closedTrades = session.lifecycle().closedTrades().size();
    }
}
