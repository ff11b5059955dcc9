package org.nowstart.rampart.strategy;

/**
 * Advisory signal source. Whatever it proposes still passes through validation, the risk brain and the
 * safety laws before anything is opened.
 */
@FunctionalInterface
public interface Strategy {

    StrategyDecision decide(StrategyContext context);
}
