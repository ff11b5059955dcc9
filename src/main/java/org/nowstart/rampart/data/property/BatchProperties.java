package org.nowstart.rampart.data.property;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@SuppressWarnings("ConfigurationProperties")
@ConfigurationProperties(prefix = "rampart.batch")
public record BatchProperties(
        Boolean enabled,
        String barsCsv,
        String engagementsCsv,
        Integer topK,
        Integer parallelism,
        Integer progressLogSeconds,
        String gridMaxStopLossPipsRange,
        String gridWinnerRewardRiskRange,
        String gridZombieBarsRange,
        String gridZombieStepPipsRange
) {
    private static final int DEFAULT_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());
    private static final int DEFAULT_PROGRESS_LOG_SECONDS = 5;
    private static final String DEFAULT_MAX_STOP_LOSS_PIPS_RANGE = "20:40:10";
    private static final String DEFAULT_WINNER_REWARD_RISK_RANGE = "1.5:3.0:0.5";
    private static final String DEFAULT_ZOMBIE_BARS_RANGE = "20:60:20";
    private static final String DEFAULT_ZOMBIE_STEP_PIPS_RANGE = "5:5:1";

    public BatchProperties {
        enabled = enabled != null ? enabled : false;
        barsCsv = barsCsv != null ? barsCsv.trim() : "";
        engagementsCsv = engagementsCsv != null ? engagementsCsv.trim() : "";
        topK = topK != null ? topK : 10;
        parallelism = parallelism != null ? parallelism : DEFAULT_PARALLELISM;
        progressLogSeconds = progressLogSeconds != null ? progressLogSeconds : DEFAULT_PROGRESS_LOG_SECONDS;
        gridMaxStopLossPipsRange = normalizeRange(gridMaxStopLossPipsRange, DEFAULT_MAX_STOP_LOSS_PIPS_RANGE);
        gridWinnerRewardRiskRange = normalizeRange(gridWinnerRewardRiskRange, DEFAULT_WINNER_REWARD_RISK_RANGE);
        gridZombieBarsRange = normalizeRange(gridZombieBarsRange, DEFAULT_ZOMBIE_BARS_RANGE);
        gridZombieStepPipsRange = normalizeRange(gridZombieStepPipsRange, DEFAULT_ZOMBIE_STEP_PIPS_RANGE);

        if (topK <= 0) {
            throw new IllegalArgumentException("top-k must be > 0");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        if (progressLogSeconds <= 0) {
            throw new IllegalArgumentException("progress-log-seconds must be > 0");
        }
    }

    public List<Double> resolveMaxStopLossPipsValues() {
        return parsePositiveDoubleRange(gridMaxStopLossPipsRange, "grid-max-stop-loss-pips-range");
    }

    public List<Double> resolveWinnerRewardRiskValues() {
        return parsePositiveDoubleRange(gridWinnerRewardRiskRange, "grid-winner-reward-risk-range");
    }

    public List<Integer> resolveZombieBarsValues() {
        List<Integer> out = new ArrayList<>();
        for (double value : parseDoubleRange(gridZombieBarsRange)) {
            int bars = (int) Math.round(value);
            if (bars < 0) {
                throw new IllegalArgumentException("grid-zombie-bars-range values must be >= 0");
            }
            out.add(bars);
        }
        return List.copyOf(out);
    }

    public List<Double> resolveZombieStepPipsValues() {
        List<Double> values = parseDoubleRange(gridZombieStepPipsRange);
        for (double value : values) {
            if (value < 0.0) {
                throw new IllegalArgumentException("grid-zombie-step-pips-range values must be >= 0");
            }
        }
        return values;
    }

    public long combinationCount() {
        long total = 1L;
        total = multiply(total, resolveMaxStopLossPipsValues().size());
        total = multiply(total, resolveWinnerRewardRiskValues().size());
        total = multiply(total, resolveZombieBarsValues().size());
        total = multiply(total, resolveZombieStepPipsValues().size());
        return total;
    }

    private static long multiply(long left, int right) {
        if (right <= 0) {
            throw new IllegalArgumentException("grid axis must not be empty");
        }
        if (left > Long.MAX_VALUE / right) {
            throw new IllegalArgumentException("grid combination count overflow");
        }
        return left * right;
    }

    private static String normalizeRange(String raw, String defaults) {
        if (raw == null || raw.isBlank()) {
            return defaults;
        }
        return raw.trim();
    }

    private static List<Double> parsePositiveDoubleRange(String range, String fieldName) {
        List<Double> values = parseDoubleRange(range);
        for (double value : values) {
            if (value <= 0.0) {
                throw new IllegalArgumentException(fieldName + " values must be > 0");
            }
        }
        return values;
    }

    private static List<Double> parseDoubleRange(String range) {
        String[] parts = range.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("range must be start:end:step, got: " + range);
        }
        double start = Double.parseDouble(parts[0].trim());
        double end = Double.parseDouble(parts[1].trim());
        double step = Double.parseDouble(parts[2].trim());
        if (step <= 0) {
            throw new IllegalArgumentException("range step must be > 0, got: " + range);
        }
        if (end < start) {
            throw new IllegalArgumentException("range end must be >= start, got: " + range);
        }

        List<Double> out = new ArrayList<>();
        for (int i = 0; ; i++) {
            double value = start + (i * step);
            if (value > end + 1e-12) {
                break;
            }
            out.add(value);
        }
        return List.copyOf(out);
    }
}
