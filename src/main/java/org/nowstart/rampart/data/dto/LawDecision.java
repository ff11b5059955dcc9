package org.nowstart.rampart.data.dto;

import org.nowstart.rampart.data.type.LawAction;
import org.nowstart.rampart.data.type.SafetyLaw;

public record LawDecision(
        SafetyLaw law,
        LawAction action,
        double newStopPrice,
        String detail
) {

    public static final LawDecision NO_OP = new LawDecision(SafetyLaw.NONE, LawAction.NO_OP, Double.NaN, "");

    public static LawDecision reject(SafetyLaw law, String detail) {
        return new LawDecision(law, LawAction.REJECT, Double.NaN, detail);
    }

    public static LawDecision forceClose(SafetyLaw law, String detail) {
        return new LawDecision(law, LawAction.FORCE_CLOSE, Double.NaN, detail);
    }

    public static LawDecision mutate(SafetyLaw law, double newStopPrice, String detail) {
        return new LawDecision(law, LawAction.MUTATE, newStopPrice, detail);
    }

    public boolean isNoOp() {
        return action == LawAction.NO_OP;
    }
}
