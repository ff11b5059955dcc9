package org.nowstart.rampart.engine;

/**
 * Converts between pips and price distances for one instrument.
 */
public record PipScale(double pipSize) {

    // absorbs binary floating point error when a price distance is converted back to pips
    static final double PIP_EPSILON = 1e-6;

    public PipScale {
        if (!Double.isFinite(pipSize) || pipSize <= 0.0) {
            throw new IllegalArgumentException("pipSize must be > 0");
        }
    }

    public double toPrice(double pips) {
        return pips * pipSize;
    }

    public double toPips(double priceDistance) {
        return priceDistance / pipSize;
    }

    public boolean atOrBeyond(double pips, double thresholdPips) {
        return pips + PIP_EPSILON >= thresholdPips;
    }
}
