package org.nowstart.rampart.engine;

/**
 * Transaction costs charged on closing fills. Implementations must be pure functions of their inputs
 * so that repeated runs reproduce the same ledger.
 */
public interface CostModel {

    double fee(double size);

    double slippage(double size, double volatilityProxy);
}
