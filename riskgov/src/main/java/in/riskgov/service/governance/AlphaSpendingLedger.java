package in.riskgov.service.governance;

import in.riskgov.config.LedgerConfig;
import in.riskgov.domain.common.BudgetExceededException;
import in.riskgov.domain.common.ConfigurationException;
import in.riskgov.domain.governance.AlphaLedgerEntry;
import in.riskgov.domain.governance.LedgerEventType;
import in.riskgov.domain.snapshot.LedgerState;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide, append-only ledger of the global type I error budget.
 *
 * Writes are serialised by a single lock; the cumulative total is published through
 * a volatile field so readers never block. The total never decreases and never
 * exceeds the budget, restore included.
 */
public final class AlphaSpendingLedger {
    private static final Logger log = LoggerFactory.getLogger(AlphaSpendingLedger.class);

    private final double totalBudget;
    private final double tolerance;
    private final Clock clock;
    private final RiskMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<AlphaLedgerEntry> entries = new ArrayList<>();
    private volatile double cumulative;
    private volatile int allocations;

    public AlphaSpendingLedger(LedgerConfig config, Clock clock, RiskMetrics metrics) {
        this.totalBudget = config.totalBudget();
        this.tolerance = config.tolerance();
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @return true if {@code amount} still fits the remaining budget
     */
    public boolean canSpend(double amount) {
        requireAmount(amount);
        return cumulative + amount <= totalBudget + tolerance;
    }

    /**
     * Append an entry. ALLOCATE consumes {@code amount} and is checked against the
     * budget; outcome events carry 0 and are always recorded.
     *
     * @throws BudgetExceededException if an allocation does not fit the remaining budget
     */
    public AlphaLedgerEntry recordSpend(String testId, double amount, LedgerEventType eventType) {
        requireAmount(amount);
        if (eventType != LedgerEventType.ALLOCATE && amount != 0.0) {
            throw new IllegalArgumentException(eventType + " entries do not consume alpha, got " + amount);
        }
        lock.lock();
        try {
            double next = cumulative;
            if (eventType == LedgerEventType.ALLOCATE) {
                next = cumulative + amount;
                if (next > totalBudget + tolerance) {
                    throw new BudgetExceededException(testId, amount, remaining());
                }
                next = Math.min(next, totalBudget);
            }
            AlphaLedgerEntry entry = new AlphaLedgerEntry(testId, amount, next, eventType, clock.instant());
            entries.add(entry);
            cumulative = next;
            if (eventType == LedgerEventType.ALLOCATE) {
                allocations++;
                metrics.recordAlphaSpend(amount, next);
                log.info("[AlphaSpendingLedger] {} allocated {} (cumulative {} of {})",
                    testId, amount, next, totalBudget);
            } else {
                log.info("[AlphaSpendingLedger] {} recorded {}", testId, eventType);
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check and allocate under one lock acquisition.
     *
     * @return false, with nothing recorded, if the amount does not fit
     */
    public boolean tryAllocate(String testId, double amount) {
        lock.lock();
        try {
            if (!canSpend(amount)) {
                return false;
            }
            recordSpend(testId, amount, LedgerEventType.ALLOCATE);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public double cumulativeAlpha() {
        return cumulative;
    }

    public double totalBudget() {
        return totalBudget;
    }

    public double remaining() {
        return Math.max(0.0, totalBudget - cumulative);
    }

    /**
     * Number of ALLOCATE entries so far.
     */
    public int allocationCount() {
        return allocations;
    }

    public List<AlphaLedgerEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public LedgerState snapshot() {
        lock.lock();
        try {
            return new LedgerState(totalBudget, cumulative, entries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the entry log with a persisted one. The restored total is the larger of
     * the persisted total and the sum of persisted allocations, so a damaged snapshot
     * can never hand budget back.
     *
     * @throws ConfigurationException if the restored total exceeds the configured budget
     */
    public void restore(LedgerState state) {
        if (state == null) {
            return;
        }
        lock.lock();
        try {
            double allocated = 0.0;
            int count = 0;
            for (AlphaLedgerEntry entry : state.entries()) {
                if (entry.eventType() == LedgerEventType.ALLOCATE) {
                    allocated += entry.alphaSpent();
                    count++;
                }
            }
            double persisted = Double.isFinite(state.cumulativeAlpha()) ? state.cumulativeAlpha() : 0.0;
            double restored = Math.max(cumulative, Math.max(persisted, allocated));
            if (restored > totalBudget + tolerance) {
                throw new ConfigurationException("ledger.totalBudget",
                    "persisted alpha spend " + restored + " exceeds configured budget " + totalBudget);
            }
            entries.clear();
            entries.addAll(state.entries());
            allocations = count;
            cumulative = restored;
            log.info("[AlphaSpendingLedger] Restored {} entries, cumulative {}", entries.size(), restored);
        } finally {
            lock.unlock();
        }
    }

    private static void requireAmount(double amount) {
        if (!Double.isFinite(amount) || amount < 0.0) {
            throw new IllegalArgumentException("alpha amount must be a non-negative finite number, got " + amount);
        }
    }
}
