package org.nowstart.rampart.engine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.locks.ReentrantLock;
import org.nowstart.rampart.data.dto.AccountSnapshot;

/**
 * Running equity and high-water mark. Writes are serialized behind a lock and publish a new immutable
 * snapshot, so concurrent readers only ever observe committed values.
 */
public class AccountState {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile AccountSnapshot snapshot;

    public AccountState(double initialEquity) {
        if (!Double.isFinite(initialEquity) || initialEquity < 0.0) {
            throw new IllegalArgumentException("initialEquity must be >= 0");
        }
        this.snapshot = new AccountSnapshot(initialEquity, initialEquity, null, initialEquity);
    }

    public AccountSnapshot snapshot() {
        return snapshot;
    }

    public AccountSnapshot applyRealizedPnl(double pnl, Instant at) {
        if (!Double.isFinite(pnl)) {
            throw new IllegalArgumentException("realized pnl must be finite");
        }
        writeLock.lock();
        try {
            AccountSnapshot current = rolled(snapshot, at);
            double equity = current.equity() + pnl;
            double peak = Math.max(current.peakEquity(), equity);
            snapshot = new AccountSnapshot(equity, peak, current.tradingDay(), current.dayStartEquity());
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    public AccountSnapshot markTime(Instant at) {
        writeLock.lock();
        try {
            snapshot = rolled(snapshot, at);
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    private AccountSnapshot rolled(AccountSnapshot current, Instant at) {
        if (at == null) {
            return current;
        }
        LocalDate day = at.atOffset(ZoneOffset.UTC).toLocalDate();
        if (day.equals(current.tradingDay())) {
            return current;
        }
        if (current.tradingDay() != null && day.isBefore(current.tradingDay())) {
            // another instrument already rolled the shared account forward
            return current;
        }
        return new AccountSnapshot(current.equity(), current.peakEquity(), day, current.equity());
    }
}
