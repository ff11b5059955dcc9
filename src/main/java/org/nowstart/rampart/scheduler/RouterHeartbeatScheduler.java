package org.nowstart.rampart.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rampart.data.dto.InstrumentStatus;
import org.nowstart.rampart.data.dto.RouterStatus;
import org.nowstart.rampart.service.RuntimeRouter;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RouterHeartbeatScheduler {

    private final RuntimeRouter runtimeRouter;

    @Scheduled(fixedDelayString = "${rampart.router.heartbeat-interval:60s}")
    public void run() {
        RouterStatus status = runtimeRouter.status();
        if (!status.running()) {
            return;
        }
        log.info(
                "event=router_heartbeat mode={} equity={} peak_equity={} drawdown={}",
                status.mode(),
                status.account() == null ? null : status.account().equity(),
                status.account() == null ? null : status.account().peakEquity(),
                status.account() == null ? null : status.account().drawdown()
        );
        for (InstrumentStatus instrument : status.instruments()) {
            log.info(
                    "event=instrument_heartbeat instrument={} active={} bars_processed={} open_positions={} closed_trades={} last_error={}",
                    instrument.instrument(),
                    instrument.active(),
                    instrument.barsProcessed(),
                    instrument.openPositions(),
                    instrument.closedTrades(),
                    instrument.lastError()
            );
        }
    }
}
