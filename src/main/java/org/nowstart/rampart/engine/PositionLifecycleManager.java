package org.nowstart.rampart.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.ClosedTrade;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.EngagementEvent;
import org.nowstart.rampart.data.dto.ExecutionAck;
import org.nowstart.rampart.data.dto.ExecutionRejection;
import org.nowstart.rampart.data.dto.LawDecision;
import org.nowstart.rampart.data.dto.LawEvent;
import org.nowstart.rampart.data.dto.OrderIntent;
import org.nowstart.rampart.data.dto.PositionSnapshot;
import org.nowstart.rampart.data.dto.StopAmendment;
import org.nowstart.rampart.data.dto.TakeProfitLevel;
import org.nowstart.rampart.data.dto.TriageDecision;
import org.nowstart.rampart.data.type.CloseReason;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.EngagementStatus;
import org.nowstart.rampart.data.type.LawAction;
import org.nowstart.rampart.data.type.MarketRegime;
import org.nowstart.rampart.data.type.OrderIntentType;
import org.nowstart.rampart.data.type.SafetyLaw;
import org.nowstart.rampart.execution.ExecutionSink;

/**
 * Bar-by-bar state machine for every position of one instrument.
 * <p>
 * Per bar: broker rejections first, then stop before take-profits, then Tourniquet, Winner, trailing and Zombie
 * on whatever is still open. Every closing fill is charged through the {@link CostModel} and committed to the
 * {@link AccountState} before the next fill is considered.
 * <p>
 * Not thread-safe; one instance is driven by exactly one thread.
 */
@Slf4j
public class PositionLifecycleManager {

    private final String instrument;
    private final PipScale pipScale;
    private final SafetyLawEvaluator laws;
    private final RiskBrain riskBrain;
    private final CostModel costModel;
    private final AccountState account;
    private final ExecutionSink sink;
    private final DecisionJournal journal;

    private final List<Position> positions = new ArrayList<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();
    private long positionSequence;

    public PositionLifecycleManager(
            String instrument,
            PipScale pipScale,
            SafetyLawEvaluator laws,
            RiskBrain riskBrain,
            CostModel costModel,
            AccountState account,
            ExecutionSink sink,
            DecisionJournal journal
    ) {
        this.instrument = instrument;
        this.pipScale = pipScale;
        this.laws = laws;
        this.riskBrain = riskBrain;
        this.costModel = costModel;
        this.account = account;
        this.sink = sink;
        this.journal = journal;
    }

    public EngagementEvent submit(Engagement engagement, MarketRegime regime, Bar bar) {
        Instant at = bar.timestamp();
        Optional<String> invalid = EngagementValidator.validate(engagement);
        if (invalid.isPresent()) {
            double requested = engagement == null ? 0.0 : engagement.requestedSize();
            return recordVerdict(at, engagement, EngagementStatus.REJECTED_INVALID, SafetyLaw.NONE, invalid.get(), requested, 0.0, null);
        }

        TriageDecision triage = riskBrain.triage(account.snapshot(), regime, engagement, openPositionCount(), openNotional());
        if (!triage.allowed()) {
            return recordVerdict(at, engagement, EngagementStatus.SKIPPED, SafetyLaw.NONE, triage.reason(), engagement.requestedSize(), 0.0, null);
        }

        LawDecision screen = laws.screen(engagement);
        if (screen.action() == LawAction.REJECT) {
            return recordVerdict(at, engagement, EngagementStatus.REJECTED_TOURNIQUET, screen.law(), screen.detail(), engagement.requestedSize(), 0.0, null);
        }

        String positionId = instrument + "-" + (++positionSequence);
        double direction = engagement.direction().sign();
        double stopPrice = engagement.entryPrice() - (direction * pipScale.toPrice(engagement.stopLossPips()));
        double size = triage.size();

        ExecutionAck ack = sink.submit(new OrderIntent(
                OrderIntentType.OPEN,
                instrument,
                positionId,
                engagement.direction(),
                size,
                engagement.entryPrice(),
                stopPrice,
                at
        ));
        if (!ack.accepted()) {
            return recordVerdict(at, engagement, EngagementStatus.REJECTED_BROKER, SafetyLaw.NONE, ack.reason(), engagement.requestedSize(), 0.0, null);
        }

        List<Position.PendingTakeProfit> takeProfits = new ArrayList<>();
        for (TakeProfitLevel level : engagement.takeProfits()) {
            double price = engagement.entryPrice() + (direction * pipScale.toPrice(level.distancePips()));
            takeProfits.add(new Position.PendingTakeProfit(price, size * level.fraction(), level.distancePips()));
        }
        takeProfits.sort(Comparator.comparingDouble(Position.PendingTakeProfit::distancePips));

        Position position = new Position(
                positionId,
                engagement.id(),
                instrument,
                engagement.direction(),
                engagement.entryPrice(),
                stopPrice,
                size,
                takeProfits,
                at
        );
        positions.add(position);
        log.debug(
                "event=position_opened instrument={} position_id={} engagement_id={} direction={} entry={} stop={} size={} verdict={}",
                instrument,
                positionId,
                engagement.id(),
                engagement.direction(),
                engagement.entryPrice(),
                stopPrice,
                size,
                triage.verdict()
        );
        return recordVerdict(at, engagement, EngagementStatus.ACCEPTED, SafetyLaw.NONE, triage.verdict().name(), engagement.requestedSize(), size, positionId);
    }

    public List<ClosedTrade> onBar(Bar bar) {
        List<ClosedTrade> closed = new ArrayList<>();
        closeBrokerRejected(bar, closed);

        for (Position position : positions) {
            if (!position.isActive()) {
                continue;
            }
            position.incrementBarsHeld();
            position.trackBestPrice(bar.high(), bar.low());

            if (position.stopCrossed(bar.low(), bar.high())) {
                closeRemaining(position, position.getStopPrice(), bar, CloseReason.STOP_LOSS, SafetyLaw.NONE, closed);
                continue;
            }
            fillTakeProfits(position, bar, closed);
            if (!position.isActive()) {
                continue;
            }
            applyLaws(position, bar, closed);
            position.markToMarket(bar.close());
        }

        prune();
        return closed;
    }

    /**
     * Applies a strategy stop amendment. Returns the trades the immediate Tourniquet check closed, if any.
     */
    public List<ClosedTrade> amendStop(StopAmendment amendment, Bar bar) {
        List<ClosedTrade> closed = new ArrayList<>();
        Position position = findActive(amendment.positionId());
        if (position == null) {
            log.debug("event=stop_amend_refused instrument={} position_id={} reason=not_active", instrument, amendment.positionId());
            return closed;
        }
        double previous = position.getStopPrice();
        if (!position.moveStop(amendment.newStopPrice(), false)) {
            log.debug(
                    "event=stop_amend_refused instrument={} position_id={} previous_stop={} requested_stop={} reason=stop_engaged",
                    instrument,
                    position.getId(),
                    previous,
                    amendment.newStopPrice()
            );
            return closed;
        }
        sink.submit(intent(OrderIntentType.AMEND_STOP, position, position.getRemainingSize(), bar.close(), bar.timestamp()));

        LawDecision tourniquet = laws.tourniquet(position);
        if (tourniquet.action() == LawAction.FORCE_CLOSE) {
            journal.record(lawEvent(bar.timestamp(), position, tourniquet, previous));
            closeRemaining(position, bar.close(), bar, CloseReason.SAFETY_LAW, SafetyLaw.TOURNIQUET, closed);
        }
        prune();
        return closed;
    }

    /**
     * Force-closes every active position at the bar close.
     */
    public List<ClosedTrade> closeAll(Bar bar, CloseReason reason) {
        List<ClosedTrade> closed = new ArrayList<>();
        for (Position position : positions) {
            if (position.isActive()) {
                closeRemaining(position, bar.close(), bar, reason, SafetyLaw.NONE, closed);
            }
        }
        prune();
        return closed;
    }

    public int openPositionCount() {
        int count = 0;
        for (Position position : positions) {
            if (position.isActive()) {
                count++;
            }
        }
        return count;
    }

    public double openNotional() {
        double total = 0.0;
        for (Position position : positions) {
            if (position.isActive()) {
                total += position.getRemainingSize() * position.getEntryPrice();
            }
        }
        return total;
    }

    public double unrealizedPnl() {
        double total = 0.0;
        for (Position position : positions) {
            if (position.isActive()) {
                total += position.getUnrealizedPnl();
            }
        }
        return total;
    }

    public List<PositionSnapshot> openPositions() {
        List<PositionSnapshot> snapshots = new ArrayList<>();
        for (Position position : positions) {
            if (position.isActive()) {
                snapshots.add(position.snapshot());
            }
        }
        return List.copyOf(snapshots);
    }

    public List<ClosedTrade> closedTrades() {
        return List.copyOf(closedTrades);
    }

    public String instrument() {
        return instrument;
    }

    private void applyLaws(Position position, Bar bar, List<ClosedTrade> closed) {
        Instant at = bar.timestamp();

        LawDecision tourniquet = laws.tourniquet(position);
        if (tourniquet.action() == LawAction.FORCE_CLOSE) {
            journal.record(lawEvent(at, position, tourniquet, position.getStopPrice()));
            closeRemaining(position, bar.close(), bar, CloseReason.SAFETY_LAW, SafetyLaw.TOURNIQUET, closed);
            return;
        }

        LawDecision winner = laws.winner(position, bar.close());
        if (winner.action() == LawAction.MUTATE) {
            double previous = position.getStopPrice();
            position.moveStop(winner.newStopPrice(), true);
            position.lockBreakeven();
            journal.record(lawEvent(at, position, winner, previous));
            notifyStop(position, bar);
        }

        LawDecision trail = laws.trail(position);
        if (trail.action() == LawAction.MUTATE) {
            double previous = position.getStopPrice();
            if (position.moveStop(trail.newStopPrice(), true)) {
                position.markTrailing();
                journal.record(lawEvent(at, position, trail, previous));
                notifyStop(position, bar);
            }
        }

        if (laws.zombieEligible(position)) {
            LawDecision zombie = laws.zombie(position);
            position.markZombieCrossings(laws.zombieCrossings(position.getBarsHeld()));
            if (zombie.action() == LawAction.MUTATE) {
                double previous = position.getStopPrice();
                if (position.moveStop(zombie.newStopPrice(), true)) {
                    journal.record(lawEvent(at, position, zombie, previous));
                    notifyStop(position, bar);
                }
            }
        }
    }

    private void fillTakeProfits(Position position, Bar bar, List<ClosedTrade> closed) {
        double extreme = position.getDirection() == Direction.LONG ? bar.high() : bar.low();
        for (Position.PendingTakeProfit level : List.copyOf(position.pendingTakeProfits())) {
            if (!position.isActive() || position.favorableDistance(extreme) < position.favorableDistance(level.price())) {
                break;
            }
            position.removeTakeProfit(level);
            bookFill(position, Math.min(level.size(), position.getRemainingSize()), level.price(), bar, true);
            if (!position.isActive()) {
                closed.add(close(position, CloseReason.TAKE_PROFIT, SafetyLaw.NONE, bar.timestamp()));
            }
        }
    }

    private void closeBrokerRejected(Bar bar, List<ClosedTrade> closed) {
        for (ExecutionRejection rejection : sink.drainRejections(instrument)) {
            Position position = findActive(rejection.positionId());
            if (position == null) {
                continue;
            }
            log.warn(
                    "event=broker_rejection instrument={} position_id={} reason={} action=force_close",
                    instrument,
                    position.getId(),
                    rejection.reason()
            );
            closeRemaining(position, bar.open(), bar, CloseReason.BROKER_REJECTED, SafetyLaw.NONE, closed);
        }
    }

    private void closeRemaining(Position position, double price, Bar bar, CloseReason reason, SafetyLaw law, List<ClosedTrade> closed) {
        bookFill(position, position.getRemainingSize(), price, bar, false);
        closed.add(close(position, reason, law, bar.timestamp()));
    }

    private void bookFill(Position position, double size, double price, Bar bar, boolean takeProfit) {
        double fee = costModel.fee(size);
        double slippage = costModel.slippage(size, bar.range());
        double net = position.fill(size, price, fee, slippage, takeProfit);
        account.applyRealizedPnl(net, bar.timestamp());
        OrderIntentType type = position.isActive() ? OrderIntentType.REDUCE : OrderIntentType.CLOSE;
        ExecutionAck ack = sink.submit(intent(type, position, size, price, bar.timestamp()));
        if (!ack.accepted()) {
            log.warn("event=close_intent_rejected instrument={} position_id={} type={} reason={}", instrument, position.getId(), type, ack.reason());
        }
    }

    private ClosedTrade close(Position position, CloseReason reason, SafetyLaw law, Instant at) {
        ClosedTrade trade = position.toClosedTrade(reason, law, at);
        closedTrades.add(trade);
        log.debug(
                "event=position_closed instrument={} position_id={} reason={} law={} exit={} realized_pnl={} bars_held={}",
                instrument,
                trade.positionId(),
                reason,
                law,
                trade.exitPrice(),
                trade.realizedPnl(),
                trade.barsHeld()
        );
        return trade;
    }

    private void notifyStop(Position position, Bar bar) {
        sink.submit(intent(OrderIntentType.AMEND_STOP, position, position.getRemainingSize(), bar.close(), bar.timestamp()));
    }

    private OrderIntent intent(OrderIntentType type, Position position, double size, double price, Instant at) {
        return new OrderIntent(type, instrument, position.getId(), position.getDirection(), size, price, position.getStopPrice(), at);
    }

    private LawEvent lawEvent(Instant at, Position position, LawDecision decision, double previousStop) {
        double newStop = decision.action() == LawAction.MUTATE ? position.getStopPrice() : previousStop;
        return new LawEvent(at, instrument, position.getId(), decision.law(), decision.action(), previousStop, newStop, decision.detail());
    }

    private EngagementEvent recordVerdict(
            Instant at,
            Engagement engagement,
            EngagementStatus status,
            SafetyLaw law,
            String reason,
            double requested,
            double accepted,
            String positionId
    ) {
        EngagementEvent event = new EngagementEvent(
                at,
                instrument,
                engagement == null ? null : engagement.id(),
                status,
                law,
                reason,
                requested,
                accepted,
                positionId
        );
        journal.record(event);
        if (status != EngagementStatus.ACCEPTED) {
            log.debug("event=engagement_refused instrument={} engagement_id={} status={} reason={}", instrument, event.engagementId(), status, reason);
        }
        return event;
    }

    private Position findActive(String positionId) {
        for (Position position : positions) {
            if (position.isActive() && position.getId().equals(positionId)) {
                return position;
            }
        }
        return null;
    }

    private void prune() {
        positions.removeIf(position -> !position.isActive());
    }
}
