package org.nowstart.rampart.engine;

import java.util.Locale;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.LawDecision;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.SafetyLaw;

/**
 * Tourniquet, Winner, trailing and Zombie laws. Pure functions of the configuration and the
 * position or engagement under inspection; callers apply them in that order.
 */
public class SafetyLawEvaluator {

    private static final double RATIO_EPSILON = 1e-9;

    private final SafetyLawConfig config;
    private final PipScale pipScale;

    public SafetyLawEvaluator(SafetyLawConfig config, PipScale pipScale) {
        this.config = config;
        this.pipScale = pipScale;
    }

    public SafetyLawConfig config() {
        return config;
    }

    public LawDecision screen(Engagement engagement) {
        if (pipScale.atOrBeyond(engagement.stopLossPips(), config.maxStopLossPips())) {
            return LawDecision.reject(
                    SafetyLaw.TOURNIQUET,
                    format("stop_loss_pips=%.4f max_stop_loss_pips=%.4f", engagement.stopLossPips(), config.maxStopLossPips())
            );
        }
        return LawDecision.NO_OP;
    }

    public LawDecision tourniquet(Position position) {
        double distancePips = pipScale.toPips(-position.favorableDistance(position.getStopPrice()));
        if (pipScale.atOrBeyond(distancePips, config.maxStopLossPips())) {
            return LawDecision.forceClose(
                    SafetyLaw.TOURNIQUET,
                    format("stop_distance_pips=%.4f max_stop_loss_pips=%.4f", distancePips, config.maxStopLossPips())
            );
        }
        return LawDecision.NO_OP;
    }

    public LawDecision winner(Position position, double markPrice) {
        if (position.isBreakevenLocked()) {
            return LawDecision.NO_OP;
        }
        double risk = position.initialRiskDistance();
        if (!(risk > 0.0)) {
            return LawDecision.NO_OP;
        }
        double unrealized = position.favorableDistance(markPrice);
        double locked = position.favorableDistance(position.getStopPrice());
        double ratio = Math.max(unrealized, locked) / risk;
        if (ratio + RATIO_EPSILON < config.winnerRewardRiskThreshold()) {
            return LawDecision.NO_OP;
        }

        double breakeven = position.getEntryPrice()
                + (position.getDirection().sign() * pipScale.toPrice(config.breakevenBufferPips()));
        double newStop = position.improvesStop(breakeven) ? breakeven : position.getStopPrice();
        return LawDecision.mutate(
                SafetyLaw.WINNER,
                newStop,
                format("reward_risk=%.4f threshold=%.4f", ratio, config.winnerRewardRiskThreshold())
        );
    }

    public LawDecision trail(Position position) {
        if (config.trailingDistancePips() <= 0.0 || !position.isBreakevenLocked()) {
            return LawDecision.NO_OP;
        }
        double candidate = position.getBestPrice()
                - (position.getDirection().sign() * pipScale.toPrice(config.trailingDistancePips()));
        if (!position.improvesStop(candidate)) {
            return LawDecision.NO_OP;
        }
        return LawDecision.mutate(
                SafetyLaw.TRAILING,
                candidate,
                format("best_price=%.6f trailing_distance_pips=%.4f", position.getBestPrice(), config.trailingDistancePips())
        );
    }

    public LawDecision zombie(Position position) {
        if (!zombieEligible(position)) {
            return LawDecision.NO_OP;
        }
        int crossings = zombieCrossings(position.getBarsHeld());
        if (crossings <= position.getZombieCrossings()) {
            return LawDecision.NO_OP;
        }

        double entry = position.getEntryPrice();
        double stepped = position.getStopPrice()
                + (position.getDirection().sign() * pipScale.toPrice(config.zombieStepPips()));
        double capped = position.getDirection() == Direction.LONG
                ? Math.min(stepped, entry)
                : Math.max(stepped, entry);
        if (!position.improvesStop(capped)) {
            return LawDecision.NO_OP;
        }
        return LawDecision.mutate(
                SafetyLaw.ZOMBIE,
                capped,
                format("bars_held=%d crossing=%d step_pips=%.4f", position.getBarsHeld(), crossings, config.zombieStepPips())
        );
    }

    /**
     * Number of staleness thresholds crossed after {@code barsHeld} bars, 0 when Zombie is disabled.
     */
    public int zombieCrossings(int barsHeld) {
        if (config.zombieStalenessBars() <= 0 || barsHeld < config.zombieStalenessBars()) {
            return 0;
        }
        return barsHeld / config.zombieStalenessBars();
    }

    public boolean zombieEligible(Position position) {
        return config.zombieStalenessBars() > 0
                && config.zombieStepPips() > 0.0
                && position.getTakeProfitsFilled() == 0
                && position.getBarsHeld() >= config.zombieStalenessBars();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
