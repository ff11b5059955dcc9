package org.nowstart.rampart.engine;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.nowstart.rampart.data.dto.AccountSnapshot;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.ClosedTrade;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.EquityPoint;
import org.nowstart.rampart.data.dto.StopAmendment;
import org.nowstart.rampart.data.type.CloseReason;
import org.nowstart.rampart.data.type.MarketRegime;
import org.nowstart.rampart.strategy.BarHistory;
import org.nowstart.rampart.strategy.Strategy;
import org.nowstart.rampart.strategy.StrategyContext;
import org.nowstart.rampart.strategy.StrategyDecision;
import org.nowstart.rampart.strategy.regime.RegimeClassifier;

/**
 * Per-bar step for one instrument: feed check, position management, regime, strategy, then the equity point.
 * The simulation driver and the live worker both run their bars through this class.
 */
public class InstrumentSession {

    @Getter
    private final String instrument;
    private final PositionLifecycleManager lifecycle;
    private final AccountState account;
    private final Strategy strategy;
    private final RegimeClassifier regimeClassifier;
    private final BarSequenceGuard guard;
    private final BarHistory history;
    private final boolean recordEquityCurve;
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    @Getter
    private long barsProcessed;
    @Getter
    private Bar lastBar;
    @Getter
    private MarketRegime lastRegime = MarketRegime.TRIAGE;

    public InstrumentSession(
            String instrument,
            PositionLifecycleManager lifecycle,
            AccountState account,
            Strategy strategy,
            RegimeClassifier regimeClassifier,
            int historyWindow,
            boolean recordEquityCurve
    ) {
        this.instrument = instrument;
        this.lifecycle = lifecycle;
        this.account = account;
        this.strategy = strategy;
        this.regimeClassifier = regimeClassifier;
        this.guard = new BarSequenceGuard(instrument);
        this.history = new BarHistory(historyWindow);
        this.recordEquityCurve = recordEquityCurve;
    }

    /**
     * Processes one bar completely. A {@link org.nowstart.rampart.data.exception.FeedIntegrityException} leaves
     * the session untouched.
     */
    public List<ClosedTrade> step(Bar bar) {
        guard.accept(bar);
        history.append(bar);
        account.markTime(bar.timestamp());
        lastBar = bar;
        barsProcessed++;

        List<ClosedTrade> closed = new ArrayList<>(lifecycle.onBar(bar));

        List<Bar> window = history.view();
        MarketRegime regime = regimeClassifier.classify(window);
        lastRegime = regime == null ? MarketRegime.TRIAGE : regime;

        StrategyDecision decision = strategy.decide(new StrategyContext(
                instrument,
                bar,
                window,
                lifecycle.openPositions(),
                account.snapshot(),
                lastRegime
        ));
        if (decision != null) {
            for (StopAmendment amendment : decision.stopAmendments()) {
                closed.addAll(lifecycle.amendStop(amendment, bar));
            }
            for (Engagement engagement : decision.engagements()) {
                lifecycle.submit(engagement, lastRegime, bar);
            }
        }

        recordEquity(bar, false);
        return closed;
    }

    /**
     * End-of-stream: force-closes whatever is still open at the last close.
     */
    public List<ClosedTrade> finish() {
        if (lastBar == null) {
            return List.of();
        }
        List<ClosedTrade> closed = lifecycle.closeAll(lastBar, CloseReason.END_OF_DATA);
        recordEquity(lastBar, true);
        return closed;
    }

    public List<EquityPoint> equityCurve() {
        return List.copyOf(equityCurve);
    }

    public PositionLifecycleManager lifecycle() {
        return lifecycle;
    }

    private void recordEquity(Bar bar, boolean replaceLast) {
        if (!recordEquityCurve) {
            return;
        }
        AccountSnapshot snapshot = account.snapshot();
        EquityPoint point = new EquityPoint(
                bar.timestamp(),
                snapshot.equity(),
                snapshot.equity() + lifecycle.unrealizedPnl(),
                snapshot.peakEquity(),
                snapshot.drawdown(),
                lifecycle.openPositionCount()
        );
        if (replaceLast && !equityCurve.isEmpty()) {
            equityCurve.set(equityCurve.size() - 1, point);
        } else {
            equityCurve.add(point);
        }
    }
}
