package org.nowstart.rampart.execution;

import org.nowstart.rampart.data.dto.ExecutionAck;
import org.nowstart.rampart.data.dto.OrderIntent;

/**
 * Backtest sink. Every intent is acknowledged; fills are modelled by the lifecycle manager.
 */
public class SimulatedExecutionSink implements ExecutionSink {

    public static final SimulatedExecutionSink INSTANCE = new SimulatedExecutionSink();

    @Override
    public ExecutionAck submit(OrderIntent intent) {
        return ExecutionAck.ok();
    }
}
