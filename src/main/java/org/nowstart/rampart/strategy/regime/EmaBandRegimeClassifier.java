package org.nowstart.rampart.strategy.regime;

import java.util.Arrays;
import java.util.List;
import org.nowstart.rampart.data.dto.Bar;
import org.nowstart.rampart.data.property.RegimeProperties;
import org.nowstart.rampart.data.type.MarketRegime;

/**
 * Last close versus an EMA anchor with a symmetric band. Above the band is BULL, below is BEAR, inside is
 * SIDEWAYS. A BEAR market whose Wilder ATR / close ratio exceeds the crash threshold is CRASH.
 * Too little history yields TRIAGE.
 */
public class EmaBandRegimeClassifier implements RegimeClassifier {

    private final RegimeProperties properties;

    public EmaBandRegimeClassifier(RegimeProperties properties) {
        this.properties = properties;
    }

    public int requiredBars() {
        return Math.max(properties.emaLength(), properties.atrPeriod());
    }

    @Override
    public MarketRegime classify(List<Bar> history) {
        if (history == null || history.size() < requiredBars()) {
            return MarketRegime.TRIAGE;
        }

        int n = history.size();
        double[] close = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        for (int i = 0; i < n; i++) {
            Bar bar = history.get(i);
            close[i] = bar.close();
            high[i] = bar.high();
            low[i] = bar.low();
        }

        double[] anchor = exponentialMovingAverage(close, properties.emaLength());
        MarketRegime regime = resolveRegime(close[n - 1], anchor[n - 1], properties.band());
        if (regime != MarketRegime.BEAR) {
            return regime;
        }

        double atr = wilderAtr(high, low, close, properties.atrPeriod());
        double last = close[n - 1];
        if (Double.isFinite(atr) && last > 0.0 && atr / last > properties.crashAtrRatio()) {
            return MarketRegime.CRASH;
        }
        return regime;
    }

    private double[] exponentialMovingAverage(double[] values, int length) {
        int n = values.length;
        double[] ema = new double[n];
        Arrays.fill(ema, Double.NaN);
        if (length <= 0 || n < length) {
            return ema;
        }

        double seed = 0.0;
        for (int i = 0; i < length; i++) {
            seed += values[i];
        }
        ema[length - 1] = seed / length;

        double alpha = 2.0 / (length + 1.0);
        for (int i = length; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    private double wilderAtr(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        if (period <= 0 || n < period) {
            return Double.NaN;
        }

        double[] tr = new double[n];
        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        double total = 0.0;
        for (int i = 0; i < period; i++) {
            total += tr[i];
        }
        double atr = total / period;
        for (int i = period; i < n; i++) {
            atr = ((atr * (period - 1)) + tr[i]) / period;
        }
        return atr;
    }

    private MarketRegime resolveRegime(double close, double anchor, double band) {
        if (!Double.isFinite(anchor)) {
            return MarketRegime.TRIAGE;
        }
        if (close > anchor * (1.0 + band)) {
            return MarketRegime.BULL;
        }
        if (close < anchor * (1.0 - band)) {
            return MarketRegime.BEAR;
        }
        return MarketRegime.SIDEWAYS;
    }
}
