package org.nowstart.rampart.data.type;

public enum PositionState {
    PENDING,
    OPEN,
    PARTIAL,
    CLOSED
}
