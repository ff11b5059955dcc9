package org.nowstart.rampart.data.type;

public enum TriageVerdict {
    ALLOW_FULL,
    ALLOW_REDUCED,
    SKIP
}
