package org.nowstart.rampart.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.Engagement;
import org.nowstart.rampart.data.dto.InstrumentStatus;
import org.nowstart.rampart.data.dto.RouterStatus;
import org.nowstart.rampart.data.dto.StopAmendment;
import org.nowstart.rampart.data.dto.TakeProfitLevel;
import org.nowstart.rampart.data.exception.RampartApiException;
import org.nowstart.rampart.data.property.CostModelConfig;
import org.nowstart.rampart.data.property.RiskBrainConfig;
import org.nowstart.rampart.data.property.RouterProperties;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.nowstart.rampart.data.property.SimulationProperties;
import org.nowstart.rampart.data.type.Direction;
import org.nowstart.rampart.data.type.ExecutionMode;
import org.nowstart.rampart.data.type.MarketRegime;
import org.nowstart.rampart.data.type.OrderIntentType;
import org.nowstart.rampart.execution.PaperExecutionService;
import org.nowstart.rampart.strategy.regime.FixedRegimeClassifier;
import org.nowstart.rampart.strategy.regime.RegimeClassifier;
import org.springframework.http.HttpStatus;

class RuntimeRouterTest {

    private static final Instant T0 = Instant.parse("2024-01-02T00:00:00Z");
    private static final Engagement ENGAGEMENT = new Engagement(
            "e-1", Direction.LONG, 1.1000, 10.0, List.of(new TakeProfitLevel(50.0, 1.0)), 1000.0);

    private RuntimeRouter router;
    private PaperExecutionService paper;

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.stop();
        }
    }

    @Test
    void start_createsOneWorkerPerDistinctInstrument() {
        router = router(ExecutionMode.PAPER, List.of("EUR_USD", " EUR_USD ", "GBP_USD", " "));
        router.start();

        RouterStatus status = router.status();

        assertThat(status.running()).isTrue();
        assertThat(status.mode()).isEqualTo(ExecutionMode.PAPER);
        assertThat(status.account().equity()).isEqualTo(100_000.0);
        assertThat(status.instruments()).extracting(InstrumentStatus::instrument).containsExactly("EUR_USD", "GBP_USD");
    }

    @Test
    void start_staysIdleWithoutInstruments() {
        router = router(ExecutionMode.PAPER, List.of());
        router.start();

        assertThat(router.isRunning()).isFalse();
        assertThat(router.status().account()).isNull();
        assertThatThrownBy(() -> router.publishBar("EUR_USD", bar(0, 1.1)))
                .isInstanceOf(RampartApiException.class)
                .extracting("code")
                .isEqualTo(RuntimeRouter.ERROR_ROUTER_STOPPED);
    }

    @Test
    void publishBar_opensQueuedEngagementOnNextBar() throws Exception {
        router = router(ExecutionMode.PAPER, List.of("EUR_USD"));
        router.start();

        router.submitEngagement("EUR_USD", ENGAGEMENT);
        router.publishBar("EUR_USD", bar(0, 1.1000));

        awaitTrue(() -> instrument("EUR_USD").openPositions() == 1);
        assertThat(paper.fills()).extracting("type").containsExactly(OrderIntentType.OPEN);
    }

    @Test
    void reportRejection_forceClosesPositionOnNextBar() throws Exception {
        router = router(ExecutionMode.PAPER, List.of("EUR_USD"));
        router.start();
        router.submitEngagement("EUR_USD", ENGAGEMENT);
        router.publishBar("EUR_USD", bar(0, 1.1000));
        awaitTrue(() -> instrument("EUR_USD").openPositions() == 1);

        router.reportRejection("EUR_USD", "EUR_USD-1", " ");
        router.publishBar("EUR_USD", bar(1, 1.0995));

        awaitTrue(() -> instrument("EUR_USD").closedTrades() == 1);
        assertThat(instrument("EUR_USD").openPositions()).isZero();
        assertThat(router.status().account().equity()).isLessThan(100_000.0);
    }

    @Test
    void reportRejection_requiresPaperMode() {
        router = router(ExecutionMode.BACKTEST, List.of("EUR_USD"));
        router.start();

        assertThatThrownBy(() -> router.reportRejection("EUR_USD", "EUR_USD-1", "margin"))
                .isInstanceOf(RampartApiException.class)
                .satisfies(ex -> {
                    RampartApiException api = (RampartApiException) ex;
                    assertThat(api.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(api.getCode()).isEqualTo(RuntimeRouter.ERROR_PAPER_MODE_REQUIRED);
                });
    }

    @Test
    void publishBar_rejectsUnknownInstrument() {
        router = router(ExecutionMode.PAPER, List.of("EUR_USD"));
        router.start();

        assertThatThrownBy(() -> router.amendStop("USD_JPY", new StopAmendment("USD_JPY-1", 150.0)))
                .isInstanceOf(RampartApiException.class)
                .satisfies(ex -> assertThat(((RampartApiException) ex).getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void feedIntegrityFailureHaltsOnlyThatInstrument() throws Exception {
        router = router(ExecutionMode.PAPER, List.of("EUR_USD", "GBP_USD"));
        router.start();

        router.publishBar("GBP_USD", bar(1, 1.2700));
        router.publishBar("GBP_USD", bar(0, 1.2700));
        awaitTrue(() -> !instrument("GBP_USD").active());

        assertThat(instrument("GBP_USD").lastError()).contains("out-of-order");
        assertThat(instrument("EUR_USD").active()).isTrue();
        assertThatThrownBy(() -> router.publishBar("GBP_USD", bar(2, 1.2700)))
                .isInstanceOf(RampartApiException.class)
                .extracting("code")
                .isEqualTo(RuntimeRouter.ERROR_INSTRUMENT_HALTED);
        router.publishBar("EUR_USD", bar(0, 1.1000));
        awaitTrue(() -> instrument("EUR_USD").barsProcessed() == 1);
    }

    @Test
    void stop_forceClosesOpenPositionsAndRefusesNewBars() throws Exception {
        router = router(ExecutionMode.PAPER, List.of("EUR_USD"));
        router.start();
        router.submitEngagement("EUR_USD", ENGAGEMENT);
        router.publishBar("EUR_USD", bar(0, 1.1000));
        awaitTrue(() -> instrument("EUR_USD").openPositions() == 1);

        router.stop();

        InstrumentStatus status = instrument("EUR_USD");
        assertThat(router.isRunning()).isFalse();
        assertThat(status.active()).isFalse();
        assertThat(status.openPositions()).isZero();
        assertThat(status.closedTrades()).isEqualTo(1);
        assertThatThrownBy(() -> router.publishBar("EUR_USD", bar(1, 1.1)))
                .isInstanceOf(RampartApiException.class)
                .extracting("code")
                .isEqualTo(RuntimeRouter.ERROR_ROUTER_STOPPED);
    }

    @Test
    void status_staysAvailableWhileStopWaitsForWorkers() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        router = router(ExecutionMode.PAPER, List.of("EUR_USD"), history -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return MarketRegime.BULL;
        });
        router.start();
        router.publishBar("EUR_USD", bar(0, 1.1000));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> stopping = CompletableFuture.runAsync(router::stop);
        awaitTrue(() -> !router.isRunning());
        RouterStatus status = CompletableFuture.supplyAsync(router::status).get(1, TimeUnit.SECONDS);

        assertThat(status.running()).isFalse();
        assertThat(stopping).isNotDone();
        release.countDown();
        stopping.get(5, TimeUnit.SECONDS);
    }

    private RuntimeRouter router(ExecutionMode mode, List<String> instruments) {
        return router(mode, instruments, new FixedRegimeClassifier(MarketRegime.BULL));
    }

    private RuntimeRouter router(ExecutionMode mode, List<String> instruments, RegimeClassifier regimeClassifier) {
        RouterProperties properties = new RouterProperties(
                mode,
                instruments,
                16,
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                0.0
        );
        paper = new PaperExecutionService(properties);
        return new RuntimeRouter(
                properties,
                new SimulationProperties("EUR_USD", 0.0001, 100_000.0, 50),
                SafetyLawConfig.defaults(),
                RiskBrainConfig.defaults(),
                CostModelConfig.free(),
                regimeClassifier,
                paper
        );
    }

    private InstrumentStatus instrument(String name) {
        return router.status().instruments().stream()
                .filter(status -> status.instrument().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(20L);
        }
    }

    private Bar bar(int minute, double price) {
        return new Bar(T0.plusSeconds(60L * minute), price, price + 0.0002, price - 0.0002, price, 10.0);
    }
}
