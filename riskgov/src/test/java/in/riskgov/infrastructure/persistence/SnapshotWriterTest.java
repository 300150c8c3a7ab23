package in.riskgov.infrastructure.persistence;

import in.riskgov.application.port.output.SnapshotStore;
import in.riskgov.config.PersistenceConfig;
import in.riskgov.domain.common.PersistenceException;
import in.riskgov.domain.snapshot.GovernanceSnapshot;
import in.riskgov.domain.snapshot.StreamSnapshot;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Write-behind snapshot persistence")
class SnapshotWriterTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:15:00Z");

    @Mock
    private SnapshotStore store;

    @Mock
    private RiskMetrics metrics;

    private final MutableClock clock = new MutableClock(T0);
    private SnapshotWriter writer;

    @BeforeEach
    void setUp() {
        writer = new SnapshotWriter(store, PersistenceConfig.defaults(), metrics, clock);
    }

    @AfterEach
    void tearDown() {
        writer.stop();
    }

    private static StreamSnapshot stream(String id, int second) {
        return new StreamSnapshot(StreamSnapshot.SCHEMA, StreamSnapshot.CURRENT_VERSION, id, T0,
            T0.plusSeconds(second), null, null, null, null, List.of());
    }

    private static PersistenceException ioFailure() {
        return new PersistenceException("stream-s1", "disk full", new IOException("disk full"));
    }

    @Test
    @DisplayName("Only the newest snapshot per key is written")
    void coalescesByKey() {
        writer.publish(stream("s1", 1));
        writer.publish(stream("s1", 2));
        writer.publish(stream("s1", 3));
        writer.publish(new GovernanceSnapshot(GovernanceSnapshot.SCHEMA, 1, T0, null, null));

        assertEquals(2, writer.flush());

        ArgumentCaptor<StreamSnapshot> saved = ArgumentCaptor.forClass(StreamSnapshot.class);
        verify(store).saveStream(saved.capture());
        assertEquals(T0.plusSeconds(3), saved.getValue().lastForecastTs());
        verify(store).saveGovernance(any(GovernanceSnapshot.class));
        verify(metrics, times(2)).recordSnapshotWrite(true);
        assertEquals(0, writer.pendingCount());
    }

    @Test
    @DisplayName("A failed write is retried after the backoff delay")
    void retriesWithBackoff() {
        doThrow(ioFailure()).doNothing().when(store).saveStream(any(StreamSnapshot.class));
        writer.publish(stream("s1", 1));

        assertEquals(0, writer.flush());
        assertEquals(1, writer.pendingCount());
        verify(metrics).recordSnapshotWrite(false);

        assertEquals(0, writer.flush(), "still backing off");
        verify(store, times(1)).saveStream(any(StreamSnapshot.class));

        clock.advance(Duration.ofMillis(100));
        assertEquals(1, writer.flush());
        assertEquals(0, writer.pendingCount());
    }

    @Test
    @DisplayName("A newer snapshot replaces a failed one while backing off")
    void newerSnapshotSupersedesFailedOne() {
        doThrow(ioFailure()).doNothing().when(store).saveStream(any(StreamSnapshot.class));
        writer.publish(stream("s1", 1));
        writer.flush();

        writer.publish(stream("s1", 2));
        clock.advance(Duration.ofMillis(100));
        assertEquals(1, writer.flush());

        ArgumentCaptor<StreamSnapshot> saved = ArgumentCaptor.forClass(StreamSnapshot.class);
        verify(store, times(2)).saveStream(saved.capture());
        assertEquals(T0.plusSeconds(2), saved.getValue().lastForecastTs());
    }

    @Test
    @DisplayName("Snapshots are dropped once retries are exhausted")
    void givesUpAfterMaxAttempts() {
        doThrow(ioFailure()).when(store).saveStream(any(StreamSnapshot.class));
        writer.publish(stream("s1", 1));

        for (int i = 0; i < 5; i++) {
            writer.flush();
            clock.advance(Duration.ofSeconds(10));
        }

        assertEquals(0, writer.pendingCount());
        verify(store, times(5)).saveStream(any(StreamSnapshot.class));

        doNothing().when(store).saveStream(any(StreamSnapshot.class));
        writer.publish(stream("s1", 2));
        assertEquals(1, writer.flush(), "a fresh round starts immediately");
    }

    @Test
    @DisplayName("A full channel drops snapshots instead of blocking")
    void fullChannelDrops() {
        writer = new SnapshotWriter(store, new PersistenceConfig("unused", 1000, 2, 100, 5000, 2.0, 5),
            metrics, clock);

        writer.publish(stream("a", 1));
        writer.publish(stream("b", 1));
        writer.publish(stream("c", 1));

        assertEquals(1, writer.droppedCount());
        assertEquals(2, writer.pendingCount());
    }

    @Test
    @DisplayName("Stopping makes a final flush")
    void stopFlushes() {
        writer.start();
        assertTrue(writer.isRunning());
        writer.publish(stream("s1", 1));

        writer.stop();

        assertFalse(writer.isRunning());
        verify(store).saveStream(any(StreamSnapshot.class));
        verify(store, never()).saveGovernance(any(GovernanceSnapshot.class));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
