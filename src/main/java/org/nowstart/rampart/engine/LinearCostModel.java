package org.nowstart.rampart.engine;

import org.nowstart.rampart.data.property.CostModelConfig;

public class LinearCostModel implements CostModel {

    private final CostModelConfig config;
    private final PipScale pipScale;

    public LinearCostModel(CostModelConfig config, PipScale pipScale) {
        this.config = config;
        this.pipScale = pipScale;
    }

    @Override
    public double fee(double size) {
        if (!Double.isFinite(size) || size <= 0.0) {
            return 0.0;
        }
        return config.feePerFill() + (config.feePerUnit() * size);
    }

    @Override
    public double slippage(double size, double volatilityProxy) {
        if (!Double.isFinite(size) || size <= 0.0) {
            return 0.0;
        }
        double range = Double.isFinite(volatilityProxy) ? Math.max(0.0, volatilityProxy) : 0.0;
        double perUnit = pipScale.toPrice(config.slippagePips()) + (config.volatilitySlippageFactor() * range);
        return size * perUnit;
    }
}
