package org.nowstart.rampart.data.type;

public enum EngagementStatus {
    ACCEPTED,
    SKIPPED,
    REJECTED_INVALID,
    REJECTED_TOURNIQUET,
    REJECTED_BROKER
}
