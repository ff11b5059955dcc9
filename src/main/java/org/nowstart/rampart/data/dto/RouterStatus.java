package org.nowstart.rampart.data.dto;

import java.util.List;
import org.nowstart.rampart.data.type.ExecutionMode;

public record RouterStatus(
        boolean running,
        ExecutionMode mode,
        AccountSnapshot account,
        List<InstrumentStatus> instruments
) {
}
