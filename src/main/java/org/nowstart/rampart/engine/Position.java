package org.nowstart.rampart.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import org.nowstart.rampart.data.dto.ClosedTrade;
import org.nowstart.rampart.data.dto.PositionSnapshot;
import org.nowstart.rampart.data.type.CloseReason;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.PositionState;
import org.nowstart.rampart.data.type.SafetyLaw;

/**
 * Live trade owned by a single {@link PositionLifecycleManager}. Not thread-safe.
 */
@Getter
public class Position {

    static final double SIZE_EPSILON = 1e-12;

    private final String id;
    private final String engagementId;
    private final String instrument;
    private final Direction direction;
    private final double entryPrice;
    private final double initialStopPrice;
    private final double initialSize;
    private final Instant openedAt;
    @Getter(AccessLevel.NONE)
    private final List<PendingTakeProfit> pendingTakeProfits;

    private PositionState state;
    private double stopPrice;
    private double remainingSize;
    private boolean breakevenLocked;
    private boolean trailing;
    private boolean stopLawEngaged;
    private int barsHeld;
    private int zombieCrossings;
    private int takeProfitsFilled;
    private double bestPrice;
    private double unrealizedPnl;
    private double grossPnl;
    private double fees;
    private double slippage;
    private double exitNotional;
    private double closedSize;

    Position(
            String id,
            String engagementId,
            String instrument,
            Direction direction,
            double entryPrice,
            double stopPrice,
            double size,
            List<PendingTakeProfit> takeProfits,
            Instant openedAt
    ) {
        this.id = id;
        this.engagementId = engagementId;
        this.instrument = instrument;
        this.direction = direction;
        this.entryPrice = entryPrice;
        this.initialStopPrice = stopPrice;
        this.stopPrice = stopPrice;
        this.initialSize = size;
        this.remainingSize = size;
        this.pendingTakeProfits = new ArrayList<>(takeProfits);
        this.openedAt = openedAt;
        this.bestPrice = entryPrice;
        this.state = PositionState.OPEN;
    }

    public boolean isActive() {
        return state == PositionState.OPEN || state == PositionState.PARTIAL;
    }

    public double initialRiskDistance() {
        return Math.abs(entryPrice - initialStopPrice);
    }

    /**
     * Signed distance of {@code price} from entry, positive when it is in the trade's favor.
     */
    public double favorableDistance(double price) {
        return (price - entryPrice) * direction.sign();
    }

    public boolean improvesStop(double candidate) {
        return (candidate - stopPrice) * direction.sign() > 0.0;
    }

    public boolean stopCrossed(double low, double high) {
        return direction == Direction.LONG ? low <= stopPrice : high >= stopPrice;
    }

    public List<PendingTakeProfit> pendingTakeProfits() {
        return Collections.unmodifiableList(pendingTakeProfits);
    }

    void incrementBarsHeld() {
        barsHeld++;
    }

    void trackBestPrice(double high, double low) {
        double candidate = direction == Direction.LONG ? high : low;
        if ((candidate - bestPrice) * direction.sign() > 0.0) {
            bestPrice = candidate;
        }
    }

    /**
     * Moves the stop. Once any law has moved the stop, only moves in the trade's favor are accepted.
     */
    boolean moveStop(double candidate, boolean byLaw) {
        if (!Double.isFinite(candidate)) {
            return false;
        }
        if (stopLawEngaged && !improvesStop(candidate)) {
            return false;
        }
        stopPrice = candidate;
        if (byLaw) {
            stopLawEngaged = true;
        }
        return true;
    }

    void lockBreakeven() {
        breakevenLocked = true;
        stopLawEngaged = true;
    }

    void markTrailing() {
        trailing = true;
    }

    void markZombieCrossings(int crossings) {
        zombieCrossings = Math.max(zombieCrossings, crossings);
    }

    /**
     * Books a closing fill and returns its realized PnL net of costs.
     */
    double fill(double size, double price, double fee, double slippageCost, boolean takeProfit) {
        double filled = Math.min(size, remainingSize);
        double gross = (price - entryPrice) * filled * direction.sign();
        grossPnl += gross;
        fees += fee;
        slippage += slippageCost;
        exitNotional += price * filled;
        closedSize += filled;
        remainingSize -= filled;
        if (takeProfit) {
            takeProfitsFilled++;
        }
        if (remainingSize <= SIZE_EPSILON * Math.max(1.0, initialSize)) {
            remainingSize = 0.0;
            state = PositionState.CLOSED;
            unrealizedPnl = 0.0;
        } else if (takeProfitsFilled > 0) {
            state = PositionState.PARTIAL;
        }
        return gross - fee - slippageCost;
    }

    void removeTakeProfit(PendingTakeProfit level) {
        pendingTakeProfits.remove(level);
    }

    void markToMarket(double price) {
        unrealizedPnl = isActive() ? (price - entryPrice) * remainingSize * direction.sign() : 0.0;
    }

    double realizedPnl() {
        return grossPnl - fees - slippage;
    }

    ClosedTrade toClosedTrade(CloseReason reason, SafetyLaw law, Instant closedAt) {
        double exitPrice = closedSize > 0.0 ? exitNotional / closedSize : entryPrice;
        return new ClosedTrade(
                id,
                engagementId,
                instrument,
                direction,
                entryPrice,
                exitPrice,
                closedSize,
                grossPnl,
                fees,
                slippage,
                realizedPnl(),
                reason,
                law,
                barsHeld,
                takeProfitsFilled,
                openedAt,
                closedAt
        );
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(
                id,
                engagementId,
                direction,
                state,
                entryPrice,
                stopPrice,
                initialSize,
                remainingSize,
                breakevenLocked,
                trailing,
                barsHeld,
                takeProfitsFilled,
                unrealizedPnl
        );
    }

    public record PendingTakeProfit(
            double price,
            double size,
            double distancePips
    ) {
    }
}
