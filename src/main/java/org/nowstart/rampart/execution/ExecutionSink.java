package org.nowstart.rampart.execution;

import java.util.List;
import org.nowstart.rampart.data.dto.ExecutionAck;
import org.nowstart.rampart.data.dto.ExecutionRejection;
import org.nowstart.rampart.data.dto.OrderIntent;

/**
 * Destination for order intents. Backtests fill against bars; paper and live sinks may refuse an
 * order synchronously or report a rejection later through {@link #drainRejections(String)}.
 */
public interface ExecutionSink {

    ExecutionAck submit(OrderIntent intent);

    default List<ExecutionRejection> drainRejections(String instrument) {
        return List.of();
    }
}
