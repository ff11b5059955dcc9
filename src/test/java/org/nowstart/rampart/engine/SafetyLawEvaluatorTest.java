package org.nowstart.rampart.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.LawDecision;
import org.nowstart.rampart.data.dto.TakeProfitLevel;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.LawAction;
import org.nowstart.rampart.data.type.SafetyLaw;

class SafetyLawEvaluatorTest {

    private static final PipScale PIPS = new PipScale(0.0001);
    private static final Instant OPENED_AT = Instant.parse("2024-01-02T00:00:00Z");

    @Test
    void screen_rejectsStopDistanceBeyondMax() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(15.0, 2.5, 40, 5.0, 0.0), PIPS);

        LawDecision decision = laws.screen(engagement(Direction.LONG, 100.0, 20.0));

        assertThat(decision.action()).isEqualTo(LawAction.REJECT);
        assertThat(decision.law()).isEqualTo(SafetyLaw.TOURNIQUET);
        assertThat(decision.detail()).contains("stop_loss_pips=20.0000");
    }

    @Test
    void screen_rejectsStopDistanceExactlyAtMax() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(15.0, 2.5, 40, 5.0, 0.0), PIPS);

        assertThat(laws.screen(engagement(Direction.SHORT, 1.1, 15.0)).action()).isEqualTo(LawAction.REJECT);
        assertThat(laws.screen(engagement(Direction.SHORT, 1.1, 14.9)).isNoOp()).isTrue();
    }

    @Test
    void tourniquet_forceClosesPositionWhoseStopWasWidened() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(15.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0990);

        assertThat(laws.tourniquet(position).isNoOp()).isTrue();

        position.moveStop(1.0980, false);
        LawDecision decision = laws.tourniquet(position);

        assertThat(decision.action()).isEqualTo(LawAction.FORCE_CLOSE);
        assertThat(decision.law()).isEqualTo(SafetyLaw.TOURNIQUET);
    }

    @Test
    void winner_movesStopToEntryPlusBufferAtThreshold() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0990);

        LawDecision below = laws.winner(position, 1.1020);
        LawDecision at = laws.winner(position, 1.1030);

        assertThat(below.isNoOp()).isTrue();
        assertThat(at.action()).isEqualTo(LawAction.MUTATE);
        assertThat(at.law()).isEqualTo(SafetyLaw.WINNER);
        assertThat(at.newStopPrice()).isCloseTo(1.1001, within(1e-9));
    }

    @Test
    void winner_isNoOpOnceLocked() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0990);
        position.moveStop(1.1001, true);
        position.lockBreakeven();

        assertThat(laws.winner(position, 1.1100).isNoOp()).isTrue();
    }

    @Test
    void winner_mirrorsForShortPositions() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.SHORT, 1.1000, 1.1010);

        LawDecision decision = laws.winner(position, 1.0970);

        assertThat(decision.action()).isEqualTo(LawAction.MUTATE);
        assertThat(decision.newStopPrice()).isCloseTo(1.0999, within(1e-9));
    }

    @Test
    void winner_keepsStrategyStopAlreadyBeyondBreakeven() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0990);
        position.moveStop(1.1010, false);

        LawDecision decision = laws.winner(position, 1.1030);

        assertThat(decision.action()).isEqualTo(LawAction.MUTATE);
        assertThat(decision.newStopPrice()).isEqualTo(1.1010);
    }

    @Test
    void trail_followsBestPriceOnlyAfterLock() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 10.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0990);
        position.trackBestPrice(1.1050, 1.1000);

        assertThat(laws.trail(position).isNoOp()).isTrue();

        position.moveStop(1.1001, true);
        position.lockBreakeven();
        LawDecision decision = laws.trail(position);

        assertThat(decision.action()).isEqualTo(LawAction.MUTATE);
        assertThat(decision.law()).isEqualTo(SafetyLaw.TRAILING);
        assertThat(decision.newStopPrice()).isCloseTo(1.1040, within(1e-9));
    }

    @Test
    void zombieCrossings_countsThresholdMultiples() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        SafetyLawEvaluator disabled = new SafetyLawEvaluator(config(30.0, 2.5, 0, 5.0, 0.0), PIPS);

        assertThat(laws.zombieCrossings(39)).isZero();
        assertThat(laws.zombieCrossings(40)).isEqualTo(1);
        assertThat(laws.zombieCrossings(79)).isEqualTo(1);
        assertThat(laws.zombieCrossings(80)).isEqualTo(2);
        assertThat(disabled.zombieCrossings(500)).isZero();
    }

    @Test
    void zombie_tightensOncePerCrossing() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0980);
        holdFor(position, 39);

        assertThat(laws.zombie(position).isNoOp()).isTrue();

        holdFor(position, 1);
        LawDecision first = laws.zombie(position);
        assertThat(first.action()).isEqualTo(LawAction.MUTATE);
        assertThat(first.law()).isEqualTo(SafetyLaw.ZOMBIE);
        assertThat(first.newStopPrice()).isCloseTo(1.0985, within(1e-9));

        position.moveStop(first.newStopPrice(), true);
        position.markZombieCrossings(laws.zombieCrossings(position.getBarsHeld()));
        holdFor(position, 10);
        assertThat(laws.zombie(position).isNoOp()).isTrue();
    }

    @Test
    void zombie_neverTightensPastEntry() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.SHORT, 1.1000, 1.1003);
        holdFor(position, 40);

        LawDecision decision = laws.zombie(position);

        assertThat(decision.action()).isEqualTo(LawAction.MUTATE);
        assertThat(decision.newStopPrice()).isEqualTo(1.1000);
    }

    @Test
    void zombie_skipsPositionsWithFilledTakeProfit() {
        SafetyLawEvaluator laws = new SafetyLawEvaluator(config(30.0, 2.5, 40, 5.0, 0.0), PIPS);
        Position position = position(Direction.LONG, 1.1000, 1.0980);
        position.fill(500.0, 1.1030, 0.0, 0.0, true);
        holdFor(position, 40);

        assertThat(laws.zombieEligible(position)).isFalse();
        assertThat(laws.zombie(position).isNoOp()).isTrue();
    }

    private void holdFor(Position position, int bars) {
        for (int i = 0; i < bars; i++) {
            position.incrementBarsHeld();
        }
    }

    private SafetyLawConfig config(double maxSl, double winnerRr, int zombieBars, double zombieStep, double trailing) {
        return new SafetyLawConfig(maxSl, winnerRr, 1.0, zombieBars, zombieStep, trailing);
    }

    private Engagement engagement(Direction direction, double entry, double stopLossPips) {
        return new Engagement("e-1", direction, entry, stopLossPips, List.of(new TakeProfitLevel(60.0, 1.0)), 1000.0);
    }

    private Position position(Direction direction, double entry, double stop) {
        return new Position("EUR_USD-1", "e-1", "EUR_USD", direction, entry, stop, 1000.0, List.of(), OPENED_AT);
    }
}
