package in.riskgov.infrastructure.persistence;

import in.riskgov.application.port.output.SnapshotPublisher;
import in.riskgov.application.port.output.SnapshotStore;
import in.riskgov.config.PersistenceConfig;
import in.riskgov.domain.common.PersistenceException;
import in.riskgov.domain.snapshot.GovernanceSnapshot;
import in.riskgov.domain.snapshot.StreamSnapshot;
import in.riskgov.infrastructure.common.RetryBackoffPolicy;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Write-behind snapshot persistence.
 *
 * Decision threads publish immutable snapshots onto a bounded channel and return at
 * once. A scheduled task drains the channel, keeps only the newest snapshot per key
 * and writes those. Failed writes stay queued and are retried with exponential
 * backoff; once the policy is exhausted the held snapshots are dropped and the next
 * published ones start a fresh round.
 */
public final class SnapshotWriter implements SnapshotPublisher {
    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    private final SnapshotStore store;
    private final PersistenceConfig config;
    private final RetryBackoffPolicy backoff;
    private final RiskMetrics metrics;
    private final Clock clock;
    private final BlockingQueue<Object> channel;
    private final ScheduledExecutorService scheduler;

    // newest unwritten snapshot per key, only touched under flush()
    private final Map<String, Object> pendingWrites = new LinkedHashMap<>();
    private ScheduledFuture<?> flushTask;
    private volatile boolean running = false;
    private final AtomicLong dropped = new AtomicLong();

    public SnapshotWriter(SnapshotStore store, PersistenceConfig config, RiskMetrics metrics, Clock clock) {
        this.store = store;
        this.config = config;
        this.backoff = RetryBackoffPolicy.from(config);
        this.metrics = metrics;
        this.clock = clock;
        this.channel = new ArrayBlockingQueue<>(config.queueCapacity());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SnapshotWriter");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void publish(StreamSnapshot snapshot) {
        offer(snapshot);
    }

    @Override
    public void publish(GovernanceSnapshot snapshot) {
        offer(snapshot);
    }

    private void offer(Object snapshot) {
        if (!channel.offer(snapshot)) {
            log.warn("[SnapshotWriter] Channel full ({}), snapshot dropped; {} dropped so far",
                config.queueCapacity(), dropped.incrementAndGet());
        }
    }

    public synchronized void start() {
        if (running) {
            log.warn("[SnapshotWriter] Already running");
            return;
        }
        running = true;
        log.info("[SnapshotWriter] Starting (flush every {} ms, dir {})", config.flushIntervalMs(), config.snapshotDir());
        flushTask = scheduler.scheduleWithFixedDelay(() -> {
            try {
                flush();
            } catch (RuntimeException e) {
                log.error("[SnapshotWriter] Flush failed", e);
            }
        }, config.flushIntervalMs(), config.flushIntervalMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the schedule and make a final flush attempt.
     */
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            log.info("[SnapshotWriter] Stopping");
            running = false;
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        backoff.reset();
        flush();
        int unwritten = pendingCount();
        if (unwritten > 0) {
            log.error("[SnapshotWriter] {} snapshots could not be written at shutdown", unwritten);
        }
    }

    /**
     * Drain the channel and write the newest snapshot of each key.
     *
     * @return number of snapshots written
     */
    public synchronized int flush() {
        List<Object> drained = new ArrayList<>();
        channel.drainTo(drained);
        for (Object snapshot : drained) {
            pendingWrites.put(keyOf(snapshot), snapshot);
        }
        if (pendingWrites.isEmpty() || !backoff.isReady(clock.instant())) {
            return 0;
        }

        int written = 0;
        List<String> keys = new ArrayList<>(pendingWrites.keySet());
        for (String key : keys) {
            Object snapshot = pendingWrites.get(key);
            try {
                write(snapshot);
                pendingWrites.remove(key);
                metrics.recordSnapshotWrite(true);
                written++;
            } catch (PersistenceException e) {
                metrics.recordSnapshotWrite(false);
                backoff.recordFailure(clock.instant());
                log.error("[SnapshotWriter] Write of {} failed (attempt {}), retry in {}: {}",
                    key, backoff.getFailureCount(), backoff.getNextDelay(), e.getMessage());
                if (backoff.isExhausted()) {
                    log.error("[SnapshotWriter] Giving up on {} pending snapshots after {} attempts",
                        pendingWrites.size(), backoff.getFailureCount());
                    pendingWrites.clear();
                    backoff.reset();
                }
                return written;
            }
        }
        backoff.recordSuccess();
        return written;
    }

    private void write(Object snapshot) {
        if (snapshot instanceof StreamSnapshot) {
            store.saveStream((StreamSnapshot) snapshot);
        } else {
            store.saveGovernance((GovernanceSnapshot) snapshot);
        }
    }

    private static String keyOf(Object snapshot) {
        if (snapshot instanceof StreamSnapshot) {
            return ((StreamSnapshot) snapshot).key();
        }
        return GovernanceSnapshot.KEY;
    }

    public synchronized int pendingCount() {
        return channel.size() + pendingWrites.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isRunning() {
        return running;
    }
}
