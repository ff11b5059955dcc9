package org.nowstart.rampart.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.AccountSnapshot;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.ClosedTrade;
import org.nowstart.rampart.data.dto.EngagementEvent;
import org.nowstart.rampart.data.dto.EquityPoint;
import org.nowstart.rampart.data.dto.ScheduledEngagement;
import org.nowstart.rampart.data.dto.SimulationRequest;
import org.nowstart.rampart.data.dto.SimulationResult;
import org.nowstart.rampart.data.dto.SimulationSummary;
import org.nowstart.rampart.data.property.CostModelConfig;
import org.nowstart.rampart.data.property.RiskBrainConfig;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.property.SimulationProperties;
import org.nowstart.rampart.data.type.EngagementStatus;
import org.nowstart.rampart.engine.AccountState;
import org.nowstart.rampart.engine.DecisionCore;
import org.nowstart.rampart.engine.DecisionJournal;
import org.nowstart.rampart.engine.InstrumentSession;
import org.nowstart.rampart.engine.PositionLifecycleManager;
import org.nowstart.rampart.execution.SimulatedExecutionSink;
import org.nowstart.rampart.feed.BarFeed;
import org.nowstart.rampart.feed.ListBarFeed;
import org.nowstart.rampart.strategy.ScheduledEngagementStrategy;
import org.nowstart.rampart.strategy.Strategy;
import org.nowstart.rampart.strategy.regime.FixedRegimeClassifier;
import org.nowstart.rampart.strategy.regime.RegimeClassifier;
import org.springframework.stereotype.Service;

/**
 * Backtest driver. Every run owns its account, positions and journal, so concurrent runs share nothing mutable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    private final SimulationProperties simulationProperties;
    private final SafetyLawConfig safetyLawConfig;
    private final RiskBrainConfig riskBrainConfig;
    private final CostModelConfig costModelConfig;
    private final RegimeClassifier regimeClassifier;

    public SimulationResult run(SimulationRequest request) {
        String instrument = request.instrument() == null || request.instrument().isBlank()
                ? simulationProperties.instrument()
                : request.instrument().trim();
        SafetyLawConfig safety = request.safety() == null ? safetyLawConfig : request.safety();
        RegimeClassifier classifier = request.regime() == null
                ? regimeClassifier
                : new FixedRegimeClassifier(request.regime());

        SimulationResult result = run(
                new ListBarFeed(instrument, request.bars()),
                new ScheduledEngagementStrategy(request.engagements()),
                safety,
                classifier
        );
        SimulationSummary summary = result.summary();
        log.info(
                "event=simulation_completed instrument={} bars={} trades={} win_rate={} net_pnl={} max_drawdown={} final_equity={}",
                instrument,
                summary.barCount(),
                summary.tradeCount(),
                formatPercent(summary.winRate()),
                summary.netPnl(),
                formatPercent(summary.maxDrawdown()),
                summary.finalEquity()
        );
        return result;
    }

    /**
     * Runs a schedule of engagements over a fixed bar list with the configured regime classifier.
     */
    public SimulationResult run(String instrument, List<Bar> bars, List<ScheduledEngagement> engagements, SafetyLawConfig safety) {
        return run(new ListBarFeed(instrument, bars), new ScheduledEngagementStrategy(engagements), safety, regimeClassifier);
    }

    public SimulationResult run(BarFeed feed, Strategy strategy, SafetyLawConfig safety, RegimeClassifier classifier) {
        String instrument = feed.instrument();
        DecisionCore core = new DecisionCore(simulationProperties.pipSize(), safety, riskBrainConfig, costModelConfig);
        AccountState account = new AccountState(simulationProperties.initialEquity());
        DecisionJournal journal = new DecisionJournal();
        PositionLifecycleManager lifecycle = core.newLifecycle(instrument, account, SimulatedExecutionSink.INSTANCE, journal);
        InstrumentSession session = new InstrumentSession(
                instrument,
                lifecycle,
                account,
                strategy,
                classifier,
                simulationProperties.historyWindow(),
                true
        );

        Bar first = null;
        try {
            Optional<Bar> next;
            while ((next = feed.next()).isPresent()) {
                Bar bar = next.get();
                session.step(bar);
                if (first == null) {
                    first = bar;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrupted instrument=" + instrument, e);
        }
        session.finish();

        List<ClosedTrade> trades = lifecycle.closedTrades();
        List<EquityPoint> equityCurve = session.equityCurve();
        List<EngagementEvent> engagementEvents = journal.engagementEvents();
        AccountSnapshot finalAccount = account.snapshot();
        SimulationSummary summary = summarize(
                session.getBarsProcessed(),
                trades,
                equityCurve,
                engagementEvents,
                finalAccount,
                first,
                session.getLastBar()
        );
        return new SimulationResult(
                instrument,
                trades,
                equityCurve,
                finalAccount,
                engagementEvents,
                journal.lawEvents(),
                summary
        );
    }

    private SimulationSummary summarize(
            long barCount,
            List<ClosedTrade> trades,
            List<EquityPoint> equityCurve,
            List<EngagementEvent> engagementEvents,
            AccountSnapshot finalAccount,
            Bar first,
            Bar last
    ) {
        int wins = 0;
        double netPnl = 0.0;
        double fees = 0.0;
        double slippage = 0.0;
        for (ClosedTrade trade : trades) {
            if (trade.isWin()) {
                wins++;
            }
            netPnl += trade.realizedPnl();
            fees += trade.fees();
            slippage += trade.slippage();
        }

        double maxDrawdown = 0.0;
        for (EquityPoint point : equityCurve) {
            maxDrawdown = Math.max(maxDrawdown, point.drawdown());
        }

        int accepted = 0;
        int skipped = 0;
        int rejected = 0;
        for (EngagementEvent event : engagementEvents) {
            if (event.status() == EngagementStatus.ACCEPTED) {
                accepted++;
            } else if (event.status() == EngagementStatus.SKIPPED) {
                skipped++;
            } else {
                rejected++;
            }
        }

        double winRate = trades.isEmpty() ? 0.0 : (double) wins / trades.size();
        String range = first == null ? "" : first.timestamp() + " -> " + last.timestamp();
        return new SimulationSummary(
                (int) barCount,
                trades.size(),
                wins,
                winRate,
                netPnl,
                fees,
                slippage,
                finalAccount.equity(),
                finalAccount.peakEquity(),
                maxDrawdown,
                accepted,
                skipped,
                rejected,
                range
        );
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }
}
