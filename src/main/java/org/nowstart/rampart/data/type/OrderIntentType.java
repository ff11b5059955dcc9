package org.nowstart.rampart.data.type;

public enum OrderIntentType {
    OPEN,
    REDUCE,
    CLOSE,
    AMEND_STOP
}
