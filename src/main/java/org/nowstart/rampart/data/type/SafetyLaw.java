package org.nowstart.rampart.data.type;

public enum SafetyLaw {
    NONE,
    TOURNIQUET,
    WINNER,
    TRAILING,
    ZOMBIE
}
