package org.nowstart.rampart.data.type;

public enum LawAction {
    REJECT,
    FORCE_CLOSE,
    MUTATE,
    NO_OP
}
