package org.nowstart.rampart.data.dto;

public record ExecutionAck(
        boolean accepted,
        String reason
) {

    private static final ExecutionAck ACCEPTED = new ExecutionAck(true, "");

    public static ExecutionAck ok() {
        return ACCEPTED;
    }

    public static ExecutionAck rejected(String reason) {
        return new ExecutionAck(false, reason);
    }
}
