package org.nowstart.rampart.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.nowstart.rampart.service.SimulationServiceTest.schedule;
import static org.nowstart.rampart.service.SimulationServiceTest.wave;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.rampart.data.dto.PackResult;
import org.nowstart.rampart.data.property.BatchProperties;
import org.nowstart.rampart.data.property.CostModelConfig;
import org.nowstart.rampart.data.property.RiskBrainConfig;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.property.SimulationProperties;
import org.nowstart.rampart.data.type.MarketRegime;
import org.nowstart.rampart.strategy.regime.FixedRegimeClassifier;

class PackBatchServiceTest {

    private final SimulationService simulationService = new SimulationService(
            new SimulationProperties("EUR_USD", 0.0001, 100_000.0, 200),
            SafetyLawConfig.defaults(),
            RiskBrainConfig.defaults(),
            CostModelConfig.free(),
            new FixedRegimeClassifier(MarketRegime.BULL)
    );
    private final PackBatchService packBatchService = new PackBatchService(simulationService, SafetyLawConfig.defaults());

    @Test
    void run_ranksEveryPackAndPutsIdlePacksLast() {
        BatchProperties config = batch(5, 2, "10:20:10", "2.0:3.0:1.0");

        List<PackResult> rows = packBatchService.run("EUR_USD", wave(300), schedule(300), config);

        assertThat(rows).hasSize(4);
        assertThat(rows.get(0).safety().maxStopLossPips()).isEqualTo(20.0);
        assertThat(rows.get(0).tradeCount()).isPositive();
        // a 10 pip tourniquet refuses every 12 pip engagement
        assertThat(rows.subList(2, 4))
                .allSatisfy(row -> {
                    assertThat(row.safety().maxStopLossPips()).isEqualTo(10.0);
                    assertThat(row.tradeCount()).isZero();
                    assertThat(row.pnlToDrawdown()).isNaN();
                });
    }

    @Test
    void run_keepsOnlyTopK() {
        BatchProperties config = batch(1, 1, "10:20:10", "2.0:3.0:1.0");

        List<PackResult> rows = packBatchService.run("EUR_USD", wave(300), schedule(300), config);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).safety().maxStopLossPips()).isEqualTo(20.0);
    }

    @Test
    void run_parallelAndSequentialAgree() {
        List<PackResult> sequential = packBatchService.run("EUR_USD", wave(200), schedule(200), batch(10, 1, "15:25:5", "2.0:2.5:0.5"));
        List<PackResult> parallel = packBatchService.run("EUR_USD", wave(200), schedule(200), batch(10, 4, "15:25:5", "2.0:2.5:0.5"));

        assertThat(parallel).containsExactlyInAnyOrderElementsOf(sequential);
    }

    @Test
    void pnlToDrawdown_handlesZeroDrawdown() {
        assertThat(PackBatchService.pnlToDrawdown(100.0, 0.05)).isEqualTo(2000.0);
        assertThat(PackBatchService.pnlToDrawdown(100.0, 0.0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(PackBatchService.pnlToDrawdown(0.0, 0.0)).isNaN();
        assertThat(PackBatchService.pnlToDrawdown(-5.0, 0.0)).isNaN();
    }

    @Test
    void rankingComparator_ordersByRatioThenPnlThenEquity() {
        SafetyLawConfig safety = SafetyLawConfig.defaults();
        PackResult nan = new PackResult(safety, Double.NaN, 0.0, 0.0, 100_000.0, 0);
        PackResult low = new PackResult(safety, 1.0, 10.0, 0.1, 100_010.0, 3);
        PackResult highLessPnl = new PackResult(safety, 5.0, 20.0, 0.04, 100_020.0, 3);
        PackResult highMorePnl = new PackResult(safety, 5.0, 30.0, 0.06, 100_030.0, 3);
        PackResult infinite = new PackResult(safety, Double.POSITIVE_INFINITY, 1.0, 0.0, 100_001.0, 1);

        List<PackResult> rows = new ArrayList<>(List.of(nan, low, highLessPnl, highMorePnl, infinite));
        rows.sort(PackBatchService.rankingComparator());

        assertThat(rows).containsExactly(infinite, highMorePnl, highLessPnl, low, nan);
    }

    private BatchProperties batch(int topK, int parallelism, String maxStopLossRange, String winnerRange) {
        return new BatchProperties(true, "bars.csv", "", topK, parallelism, 60, maxStopLossRange, winnerRange, "40:40:1", "5:5:1");
    }
}
