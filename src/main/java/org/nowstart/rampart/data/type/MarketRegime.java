package org.nowstart.rampart.data.type;

public enum MarketRegime {
    BULL,
    BEAR,
    SIDEWAYS,
    CRASH,
    TRIAGE
}
