package org.nowstart.rampart.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.InstrumentStatus;
import org.nowstart.rampart.data.dto.RouterStatus;
import org.nowstart.rampart.data.dto.StopAmendment;
import org.nowstart.rampart.data.exception.RampartApiException;
import org.nowstart.rampart.data.property.CostModelConfig;
import org.nowstart.rampart.data.property.RiskBrainConfig;
import org.nowstart.rampart.data.property.RouterProperties;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.property.SimulationProperties;
import org.nowstart.rampart.data.type.ExecutionMode;
import org.nowstart.rampart.engine.AccountState;
import org.nowstart.rampart.engine.DecisionCore;
import org.nowstart.rampart.engine.DecisionJournal;
import org.nowstart.rampart.engine.InstrumentSession;
import org.nowstart.rampart.execution.ExecutionSink;
import org.nowstart.rampart.execution.PaperExecutionService;
import org.nowstart.rampart.execution.SimulatedExecutionSink;
import org.nowstart.rampart.feed.LiveBarFeed;
import org.nowstart.rampart.strategy.QueuedEngagementStrategy;
import org.nowstart.rampart.strategy.regime.RegimeClassifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Live counterpart of {@link SimulationService}: one worker thread per instrument, every worker running the
 * same decision core against one shared account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuntimeRouter {

    public static final String ERROR_UNKNOWN_INSTRUMENT = "unknown_instrument";
    public static final String ERROR_ROUTER_STOPPED = "router_stopped";
    public static final String ERROR_INSTRUMENT_HALTED = "instrument_halted";
    public static final String ERROR_FEED_BACKPRESSURE = "feed_backpressure";
    public static final String ERROR_PAPER_MODE_REQUIRED = "paper_mode_required";

    private static final long PUBLISH_TIMEOUT_MILLIS = 1_000L;

    private final RouterProperties routerProperties;
    private final SimulationProperties simulationProperties;
    private final SafetyLawConfig safetyLawConfig;
    private final RiskBrainConfig riskBrainConfig;
    private final CostModelConfig costModelConfig;
    private final RegimeClassifier regimeClassifier;
    private final PaperExecutionService paperExecutionService;

    private final Map<String, InstrumentWorker> workers = new LinkedHashMap<>();
    private volatile AccountState account;
    private volatile ExecutorService pool;
    private volatile boolean running;

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        List<String> instruments = routerProperties.instruments().stream()
                .map(String::trim)
                .filter(instrument -> !instrument.isEmpty())
                .distinct()
                .toList();
        if (instruments.isEmpty()) {
            log.info("event=router_idle reason=no_instruments");
            return;
        }

        account = new AccountState(simulationProperties.initialEquity());
        DecisionCore core = new DecisionCore(simulationProperties.pipSize(), safetyLawConfig, riskBrainConfig, costModelConfig);
        ExecutionSink sink = routerProperties.executionMode() == ExecutionMode.PAPER
                ? paperExecutionService
                : SimulatedExecutionSink.INSTANCE;

        workers.clear();
        for (String instrument : instruments) {
            LiveBarFeed feed = new LiveBarFeed(instrument, routerProperties.feedCapacity());
            QueuedEngagementStrategy strategy = new QueuedEngagementStrategy();
            InstrumentSession session = new InstrumentSession(
                    instrument,
                    core.newLifecycle(instrument, account, sink, new DecisionJournal()),
                    account,
                    strategy,
                    regimeClassifier,
                    simulationProperties.historyWindow(),
                    false
            );
            workers.put(instrument, new InstrumentWorker(feed, strategy, session));
        }

        AtomicInteger threadIndex = new AtomicInteger();
        pool = Executors.newFixedThreadPool(workers.size(), runnable -> {
            Thread thread = new Thread(runnable, "rampart-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        });
        workers.values().forEach(pool::submit);
        running = true;
        log.info(
                "event=router_started mode={} instruments={} initial_equity={}",
                routerProperties.executionMode(),
                instruments,
                simulationProperties.initialEquity()
        );
    }

    public void publishBar(String instrument, Bar bar) {
        InstrumentWorker worker = requireActiveWorker(instrument);
        boolean published;
        try {
            published = worker.feed().publish(bar, PUBLISH_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RampartApiException(HttpStatus.SERVICE_UNAVAILABLE, ERROR_FEED_BACKPRESSURE, "Interrupted while publishing bar");
        }
        if (!published) {
            throw new RampartApiException(
                    HttpStatus.SERVICE_UNAVAILABLE,
                    ERROR_FEED_BACKPRESSURE,
                    "Feed for " + instrument + " is not accepting bars"
            );
        }
    }

    public void submitEngagement(String instrument, Engagement engagement) {
        requireActiveWorker(instrument).strategy().enqueue(engagement);
        log.info("event=engagement_queued instrument={} engagement_id={}", instrument, engagement.id());
    }

    public void amendStop(String instrument, StopAmendment amendment) {
        requireActiveWorker(instrument).strategy().enqueue(amendment);
        log.info("event=stop_amendment_queued instrument={} position_id={}", instrument, amendment.positionId());
    }

    /**
     * Simulates an asynchronous broker rejection of an open paper position; its worker force-closes it on the
     * next bar.
     */
    public void reportRejection(String instrument, String positionId, String reason) {
        requireActiveWorker(instrument);
        if (routerProperties.executionMode() != ExecutionMode.PAPER) {
            throw new RampartApiException(HttpStatus.CONFLICT, ERROR_PAPER_MODE_REQUIRED, "Rejections can only be reported in PAPER mode");
        }
        paperExecutionService.reportRejection(instrument, positionId, reason == null || reason.isBlank() ? "BROKER_REJECTED" : reason);
    }

    public RouterStatus status() {
        List<InstrumentStatus> statuses = new ArrayList<>();
        synchronized (this) {
            for (InstrumentWorker worker : workers.values()) {
                statuses.add(worker.status());
            }
        }
        AccountState current = account;
        return new RouterStatus(
                running,
                routerProperties.executionMode(),
                current == null ? null : current.snapshot(),
                List.copyOf(statuses)
        );
    }

    /**
     * Ends every feed and waits, bounded by the shutdown timeout, for workers to finish their end-of-stream
     * force-close before the pool is released.
     */
    @PreDestroy
    public void stop() {
        ExecutorService stopping;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            for (InstrumentWorker worker : workers.values()) {
                worker.feed().end();
            }
            stopping = pool;
            stopping.shutdown();
        }
        // awaited outside the monitor
        long timeoutMillis = routerProperties.shutdownTimeout().toMillis();
        try {
            if (!stopping.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("event=router_stop_timeout timeout_ms={} action=interrupt_workers", timeoutMillis);
                stopping.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping.shutdownNow();
        }
        log.info("event=router_stopped account_equity={}", account.snapshot().equity());
    }

    public boolean isRunning() {
        return running;
    }

    private synchronized InstrumentWorker requireActiveWorker(String instrument) {
        if (!running) {
            throw new RampartApiException(HttpStatus.CONFLICT, ERROR_ROUTER_STOPPED, "Router is not running");
        }
        InstrumentWorker worker = workers.get(instrument);
        if (worker == null) {
            throw new RampartApiException(HttpStatus.NOT_FOUND, ERROR_UNKNOWN_INSTRUMENT, "Unknown instrument: " + instrument);
        }
        if (!worker.isActive()) {
            throw new RampartApiException(HttpStatus.CONFLICT, ERROR_INSTRUMENT_HALTED, "Instrument halted: " + instrument);
        }
        return worker;
    }
}
