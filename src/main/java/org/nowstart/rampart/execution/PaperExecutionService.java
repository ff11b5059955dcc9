package org.nowstart.rampart.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.ExecutionAck;
import org.nowstart.rampart.data.dto.ExecutionRejection;
import org.nowstart.rampart.data.dto.OrderIntent;
import org.nowstart.rampart.data.dto.PaperFill;
import org.nowstart.rampart.data.property.RouterProperties;
import org.nowstart.rampart.data.type.OrderIntentType;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaperExecutionService implements ExecutionSink {

    public static final String REJECT_REASON_NOTIONAL_CAP = "NOTIONAL_CAP_EXCEEDED";

    private static final int MAX_RETAINED_FILLS = 10_000;

    private final RouterProperties routerProperties;

    private final Deque<PaperFill> fills = new ArrayDeque<>();
    private final Map<String, Queue<ExecutionRejection>> pendingRejections = new ConcurrentHashMap<>();

    @Override
    public ExecutionAck submit(OrderIntent intent) {
        if (intent.type() == OrderIntentType.OPEN && exceedsNotionalCap(intent)) {
            log.warn(
                    "event=paper_order_rejected instrument={} position_id={} size={} price={} max_notional={} reason={}",
                    intent.instrument(),
                    intent.positionId(),
                    intent.size(),
                    intent.price(),
                    routerProperties.maxOrderNotional(),
                    REJECT_REASON_NOTIONAL_CAP
            );
            return ExecutionAck.rejected(REJECT_REASON_NOTIONAL_CAP);
        }

        if (intent.type() == OrderIntentType.AMEND_STOP) {
            log.info(
                    "event=paper_stop_amended instrument={} position_id={} stop_price={}",
                    intent.instrument(),
                    intent.positionId(),
                    intent.stopPrice()
            );
            return ExecutionAck.ok();
        }

        PaperFill fill = new PaperFill(
                intent.instrument(),
                intent.positionId(),
                intent.type(),
                intent.direction(),
                intent.size(),
                intent.price(),
                intent.at()
        );
        synchronized (fills) {
            fills.addLast(fill);
            while (fills.size() > MAX_RETAINED_FILLS) {
                fills.removeFirst();
            }
        }
        log.info(
                "event=paper_fill instrument={} position_id={} type={} direction={} size={} price={}",
                fill.instrument(),
                fill.positionId(),
                fill.type(),
                fill.direction(),
                fill.size(),
                fill.price()
        );
        return ExecutionAck.ok();
    }

    /**
     * Records an asynchronous rejection for an already acknowledged order. The owning worker force-closes the
     * position on its next bar.
     */
    public void reportRejection(String instrument, String positionId, String reason) {
        pendingRejections
                .computeIfAbsent(instrument, key -> new ConcurrentLinkedQueue<>())
                .add(new ExecutionRejection(instrument, positionId, reason));
        log.warn("event=paper_rejection_reported instrument={} position_id={} reason={}", instrument, positionId, reason);
    }

    @Override
    public List<ExecutionRejection> drainRejections(String instrument) {
        Queue<ExecutionRejection> queue = pendingRejections.get(instrument);
        if (queue == null) {
            return List.of();
        }
        List<ExecutionRejection> drained = new ArrayList<>();
        ExecutionRejection rejection;
        while ((rejection = queue.poll()) != null) {
            drained.add(rejection);
        }
        return drained;
    }

    public List<PaperFill> fills() {
        synchronized (fills) {
            return List.copyOf(fills);
        }
    }

    private boolean exceedsNotionalCap(OrderIntent intent) {
        double cap = routerProperties.maxOrderNotional();
        return cap > 0.0 && intent.size() * intent.price() > cap;
    }
}
