package org.nowstart.rampart.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;
import java.util.stream.LongStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.dto.PackResult;
import org.nowstart.rampart.data.dto.ScheduledEngagement;
import org.nowstart.rampart.data.dto.SimulationResult;
import org.nowstart.rampart.data.dto.SimulationSummary;
import org.nowstart.rampart.data.property.BatchProperties;
import org.nowstart.rampart.data.property.SafetyLawConfig;
import org.springframework.stereotype.Service;

/**
 * Runs every safety-law pack of the configured grid over the same bars and engagement schedule and keeps the
 * best {@code topK}. Packs are independent simulations and run in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackBatchService {

    private final SimulationService simulationService;
    private final SafetyLawConfig safetyLawConfig;

    public List<PackResult> run(
            String instrument,
            List<Bar> bars,
            List<ScheduledEngagement> engagements,
            BatchProperties config
    ) {
        List<Double> maxStopLossValues = config.resolveMaxStopLossPipsValues();
        List<Double> winnerValues = config.resolveWinnerRewardRiskValues();
        List<Integer> zombieBarValues = config.resolveZombieBarsValues();
        List<Double> zombieStepValues = config.resolveZombieStepPipsValues();

        int[] sizes = {
                maxStopLossValues.size(),
                winnerValues.size(),
                zombieBarValues.size(),
                zombieStepValues.size()
        };

        long total = config.combinationCount();
        long[] strides = buildStrides(sizes);
        Comparator<PackResult> better = rankingComparator();
        int topK = config.topK();
        long startedAtNanos = System.nanoTime();
        long logIntervalNanos = TimeUnit.SECONDS.toNanos(config.progressLogSeconds());
        AtomicLong processed = new AtomicLong(0L);
        AtomicLong nextLogAtNanos = new AtomicLong(startedAtNanos + logIntervalNanos);

        PriorityQueue<PackResult> heap = runPacks(
                total,
                config.parallelism(),
                topK,
                better,
                index -> {
                    SafetyLawConfig pack = safetyLawConfig.withPack(
                            maxStopLossValues.get(coord(index, strides[0], sizes[0])),
                            winnerValues.get(coord(index, strides[1], sizes[1])),
                            zombieBarValues.get(coord(index, strides[2], sizes[2])),
                            zombieStepValues.get(coord(index, strides[3], sizes[3]))
                    );
                    PackResult result = evaluate(instrument, bars, engagements, pack);
                    logProgress(processed, nextLogAtNanos, logIntervalNanos, total, startedAtNanos);
                    return result;
                }
        );

        logProgressFinal(processed.get(), total, startedAtNanos);

        List<PackResult> out = new ArrayList<>(heap);
        out.sort(better);
        return List.copyOf(out);
    }

    PackResult evaluate(String instrument, List<Bar> bars, List<ScheduledEngagement> engagements, SafetyLawConfig pack) {
        SimulationResult result = simulationService.run(instrument, bars, engagements, pack);
        SimulationSummary summary = result.summary();
        return new PackResult(
                pack,
                pnlToDrawdown(summary.netPnl(), summary.maxDrawdown()),
                summary.netPnl(),
                summary.maxDrawdown(),
                summary.finalEquity(),
                summary.tradeCount()
        );
    }

    static double pnlToDrawdown(double netPnl, double maxDrawdown) {
        if (maxDrawdown > 0.0) {
            return netPnl / maxDrawdown;
        }
        // a profitable pack that never drew down beats any ratio
        return netPnl > 0.0 ? Double.POSITIVE_INFINITY : Double.NaN;
    }

    static Comparator<PackResult> rankingComparator() {
        return Comparator
                .comparingDouble((PackResult row) -> rankValue(row.pnlToDrawdown())).reversed()
                .thenComparing(Comparator.comparingDouble((PackResult row) -> rankValue(row.netPnl())).reversed())
                .thenComparing(Comparator.comparingDouble((PackResult row) -> rankValue(row.finalEquity())).reversed());
    }

    private int coord(long index, long stride, int size) {
        return (int) ((index / stride) % size);
    }

    private long[] buildStrides(int[] sizes) {
        long[] strides = new long[sizes.length];
        long stride = 1L;
        for (int i = sizes.length - 1; i >= 0; i--) {
            strides[i] = stride;
            if (sizes[i] > 0 && stride > Long.MAX_VALUE / sizes[i]) {
                throw new IllegalArgumentException("pack grid stride overflow");
            }
            stride *= sizes[i];
        }
        return strides;
    }

    private PriorityQueue<PackResult> runPacks(
            long total,
            int parallelism,
            int topK,
            Comparator<PackResult> better,
            LongFunction<PackResult> evaluator
    ) {
        if (parallelism <= 1) {
            return collectTopK(LongStream.range(0, total), topK, better, evaluator);
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> collectTopK(LongStream.range(0, total).parallel(), topK, better, evaluator)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Pack batch interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Pack batch failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private PriorityQueue<PackResult> collectTopK(
            LongStream stream,
            int topK,
            Comparator<PackResult> better,
            LongFunction<PackResult> evaluator
    ) {
        return stream.collect(
                () -> new PriorityQueue<>(topK, better.reversed()),
                (heap, index) -> offerTopK(heap, evaluator.apply(index), topK, better),
                (left, right) -> {
                    for (PackResult row : right) {
                        offerTopK(left, row, topK, better);
                    }
                }
        );
    }

    private void offerTopK(PriorityQueue<PackResult> heap, PackResult row, int topK, Comparator<PackResult> better) {
        if (heap.size() < topK) {
            heap.offer(row);
            return;
        }
        PackResult worst = heap.peek();
        if (worst != null && better.compare(row, worst) < 0) {
            heap.poll();
            heap.offer(row);
        }
    }

    private static double rankValue(double value) {
        return Double.isNaN(value) ? Double.NEGATIVE_INFINITY : value;
    }

    private void logProgress(
            AtomicLong processed,
            AtomicLong nextLogAtNanos,
            long logIntervalNanos,
            long total,
            long startedAtNanos
    ) {
        long done = processed.incrementAndGet();
        long now = System.nanoTime();
        long targetNanos = nextLogAtNanos.get();
        if (now < targetNanos || !nextLogAtNanos.compareAndSet(targetNanos, now + logIntervalNanos)) {
            return;
        }

        double elapsedSec = Math.max(1e-9, (now - startedAtNanos) / 1_000_000_000.0);
        log.info(
                "event=pack_batch_progress done={} total={} pct={} rate_per_sec={}",
                done,
                total,
                String.format(Locale.US, "%.2f", (done * 100.0) / Math.max(1L, total)),
                Math.round(done / elapsedSec)
        );
    }

    private void logProgressFinal(long done, long total, long startedAtNanos) {
        double elapsedSec = Math.max(1e-9, (System.nanoTime() - startedAtNanos) / 1_000_000_000.0);
        log.info(
                "event=pack_batch_done done={} total={} elapsed_sec={} rate_per_sec={}",
                done,
                total,
                String.format(Locale.US, "%.2f", elapsedSec),
                Math.round(done / elapsedSec)
        );
    }
}
