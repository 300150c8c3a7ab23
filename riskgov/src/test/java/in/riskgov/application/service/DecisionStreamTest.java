package in.riskgov.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.riskgov.application.port.output.SnapshotPublisher;
import in.riskgov.config.EngineConfig;
import in.riskgov.config.StreamConfig;
import in.riskgov.domain.acceptance.CycleDecision;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.common.InvalidInputException;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.forecast.Forecast;
import in.riskgov.domain.forecast.GroundTruth;
import in.riskgov.domain.snapshot.StreamSnapshot;
import in.riskgov.infrastructure.metrics.NoOpRiskMetrics;
import in.riskgov.infrastructure.persistence.JsonMappers;
import in.riskgov.service.execution.ExecutionRiskGate;
import in.riskgov.service.uncertainty.UncertaintyAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Decision stream cycle")
class DecisionStreamTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:15:00Z");
    private static final double POINT = 100.0;
    private static final double SIGMA = 0.3;

    private final AtomicLong nanos = new AtomicLong();
    private volatile long nanosPerRead;
    private EngineConfig config;
    private DecisionStream stream;
    private int seq;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        stream = newStream("s1", SnapshotPublisher.DISCARD);
        seq = 0;
        nanosPerRead = 0;
    }

    private DecisionStream newStream(String id, SnapshotPublisher publisher) {
        return new DecisionStream(id, config, new UncertaintyAggregator(config.aggregator()),
            new ExecutionRiskGate(config.gate(), NoOpRiskMetrics.INSTANCE), NoOpRiskMetrics.INSTANCE, publisher,
            () -> nanos.getAndAdd(nanosPerRead));
    }

    private Forecast nextForecast() {
        return Forecast.of(T0.plusSeconds(seq++), POINT, SIGMA, 1_000.0);
    }

    @Test
    @DisplayName("A calm forecast trades at full size")
    void calmCyclePasses() {
        CycleDecision decision = stream.process(nextForecast());

        assertEquals(Posture.PASS, decision.posture());
        assertEquals(1.0, decision.riskScale(), 0.0);
        assertEquals(1_000.0, decision.recommendedNotional(), 1e-9);
        assertNull(decision.blockReason());
        assertFalse(decision.stale());
        assertEquals(2 * 1.645 * SIGMA, decision.interval().width(), 1e-3);
        assertTrue(decision.kappa() < 0.6);
    }

    @Test
    @DisplayName("Timestamps must be strictly increasing")
    void rejectsNonIncreasingTimestamps() {
        stream.process(Forecast.of(T0.plusSeconds(10), POINT, SIGMA, 1_000.0));

        assertThrows(InvalidInputException.class,
            () -> stream.process(Forecast.of(T0.plusSeconds(10), POINT, SIGMA, 1_000.0)));
        assertThrows(InvalidInputException.class,
            () -> stream.process(Forecast.of(T0.plusSeconds(5), POINT, SIGMA, 1_000.0)));
        assertThrows(InvalidInputException.class,
            () -> stream.process(Forecast.of(null, POINT, SIGMA, 1_000.0)));
        assertNotNull(stream.process(Forecast.of(T0.plusSeconds(11), POINT, SIGMA, 1_000.0)));
    }

    @Test
    @DisplayName("An invalid sigma is rejected without advancing the stream")
    void rejectsInvalidSigma() {
        Instant ts = T0.plusSeconds(1);
        assertThrows(InvalidInputException.class, () -> stream.process(Forecast.of(ts, POINT, 0.0, 1_000.0)));
        assertNotNull(stream.process(Forecast.of(ts, POINT, SIGMA, 1_000.0)));
    }

    @Test
    @DisplayName("Ground truth is matched to its forecast by timestamp")
    void groundTruthMatching() {
        Forecast forecast = nextForecast();
        stream.process(forecast);

        assertThrows(InvalidInputException.class,
            () -> stream.onGroundTruth(new GroundTruth(T0.minusSeconds(60), POINT)));
        assertTrue(stream.onGroundTruth(new GroundTruth(forecast.timestamp(), POINT + 0.1)));
        assertThrows(InvalidInputException.class,
            () -> stream.onGroundTruth(new GroundTruth(forecast.timestamp(), POINT)),
            "a forecast is scored only once");
    }

    @Test
    @DisplayName("Sustained high latency blocks the stream")
    void latencyBlocks() {
        CycleDecision decision = null;
        for (int i = 0; i < 10; i++) {
            decision = stream.process(nextForecast().withLatencyMs(200.0));
            assertEquals(0.0, decision.recommendedNotional(), 0.0, "cycle " + i);
        }

        assertEquals(Posture.BLOCK, decision.posture());
        assertEquals(0.0, decision.riskScale(), 0.0);
        assertEquals(BlockReason.LATENCY_P95, decision.blockReason());
    }

    @Test
    @DisplayName("A cycle over budget returns the previous decision marked stale")
    void staleCycles() {
        nanosPerRead = TimeUnit.MILLISECONDS.toNanos(60);
        CycleDecision first = stream.process(nextForecast());
        assertTrue(first.stale());
        assertEquals(0.0, first.recommendedNotional(), 0.0);
        assertEquals(BlockReason.STALE_DECISION, first.blockReason());

        nanosPerRead = 0;
        CycleDecision fresh = stream.process(nextForecast());
        assertFalse(fresh.stale());

        nanosPerRead = TimeUnit.MILLISECONDS.toNanos(60);
        Forecast late = nextForecast();
        CycleDecision stale = stream.process(late);
        assertTrue(stale.stale());
        assertEquals(late.timestamp(), stale.timestamp());
        assertEquals(fresh.recommendedNotional(), stale.recommendedNotional(), 0.0);
        assertSame(fresh, stream.lastDecision());
    }

    @Test
    @DisplayName("Snapshots are published every N cycles")
    void periodicSnapshots() {
        SnapshotPublisher publisher = mock(SnapshotPublisher.class);
        config = config.withStream(new StreamConfig(50, 3, 1024));
        stream = newStream("s1", publisher);

        for (int i = 0; i < 7; i++) {
            stream.process(nextForecast());
        }

        verify(publisher, times(2)).publish(any(StreamSnapshot.class));
    }

    @Test
    @DisplayName("A stream restored from JSON makes the same decisions")
    void jsonSnapshotResumesExactly() throws Exception {
        Random noise = new Random(42);
        for (int i = 0; i < 150; i++) {
            Forecast forecast = nextForecast();
            stream.process(forecast);
            stream.onGroundTruth(new GroundTruth(forecast.timestamp(), POINT + SIGMA * noise.nextGaussian()));
        }

        ObjectMapper mapper = JsonMappers.snapshotMapper();
        String json = mapper.writeValueAsString(stream.snapshot());
        DecisionStream resumed = newStream("s1", SnapshotPublisher.DISCARD);
        resumed.restore(mapper.readValue(json, StreamSnapshot.class));

        for (int i = 0; i < 50; i++) {
            Forecast forecast = nextForecast();
            assertEquals(stream.process(forecast), resumed.process(forecast), "cycle " + i);
            GroundTruth truth = new GroundTruth(forecast.timestamp(), POINT + SIGMA * noise.nextGaussian());
            assertEquals(stream.onGroundTruth(truth), resumed.onGroundTruth(truth));
        }
    }

    @Test
    @DisplayName("A snapshot of another stream is refused")
    void rejectsForeignSnapshot() {
        stream.process(nextForecast());
        StreamSnapshot snapshot = stream.snapshot();

        DecisionStream other = newStream("s2", SnapshotPublisher.DISCARD);
        assertThrows(IllegalArgumentException.class, () -> other.restore(snapshot));
    }

    @Test
    @DisplayName("Restored pending forecasts can still be scored")
    void restoredPendingForecasts() {
        Forecast forecast = nextForecast();
        stream.process(forecast);

        DecisionStream resumed = newStream("s1", SnapshotPublisher.DISCARD);
        resumed.restore(stream.snapshot());

        assertTrue(resumed.onGroundTruth(new GroundTruth(forecast.timestamp(), POINT)));
        assertThrows(InvalidInputException.class, () -> resumed.process(forecast),
            "last forecast timestamp is restored");
    }
}
