package org.nowstart.rampart.data.type;

public enum ExecutionMode {
    BACKTEST,
    PAPER
}
