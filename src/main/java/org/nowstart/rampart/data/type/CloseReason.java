package org.nowstart.rampart.data.type;

public enum CloseReason {
    STOP_LOSS,
    TAKE_PROFIT,
    SAFETY_LAW,
    END_OF_DATA,
    BROKER_REJECTED
}
