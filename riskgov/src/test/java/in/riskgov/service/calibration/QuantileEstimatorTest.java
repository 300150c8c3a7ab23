package in.riskgov.service.calibration;

import in.riskgov.config.QuantileConfig;
import in.riskgov.domain.snapshot.QuantileState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Streaming quantile estimator")
class QuantileEstimatorTest {

    private QuantileEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new QuantileEstimator(QuantileConfig.defaults());
    }

    @Test
    @DisplayName("Returns the safe default before any observation")
    void safeDefaultWhenEmpty() {
        assertEquals(1.645, estimator.estimate(0.9), 0.0);
        assertEquals(0, estimator.count());
        assertFalse(estimator.isWarm());
    }

    @Test
    @DisplayName("Warm-up estimate is the exact interpolated quantile")
    void exactDuringWarmup() {
        for (int i = 10; i >= 1; i--) {
            estimator.observe(i);
        }
        assertEquals(5.5, estimator.estimate(0.5), 1e-12);
        assertEquals(1.0, estimator.estimate(0.0), 1e-12);
        assertEquals(10.0, estimator.estimate(1.0), 1e-12);
        assertEquals(9.1, estimator.estimate(0.9), 1e-12);
        assertFalse(estimator.isWarm());
    }

    @Test
    @DisplayName("Non-finite values are ignored")
    void ignoresNonFinite() {
        estimator.observe(Double.NaN);
        estimator.observe(Double.POSITIVE_INFINITY);
        estimator.observe(2.0);
        assertEquals(1, estimator.count());
        assertEquals(2.0, estimator.estimate(0.99), 0.0);
    }

    @Test
    @DisplayName("Marker phase tracks uniform quantiles")
    void tracksUniformAfterWarmup() {
        Random random = new Random(7);
        for (int i = 0; i < 20_000; i++) {
            estimator.observe(random.nextDouble());
        }
        assertTrue(estimator.isWarm());
        assertEquals(0.5, estimator.estimate(0.5), 0.02);
        assertEquals(0.9, estimator.estimate(0.9), 0.02);
        assertEquals(0.99, estimator.estimate(0.99), 0.015);
    }

    @Test
    @DisplayName("Marker phase tracks the 95% quantile of |N(0,1)|")
    void tracksAbsoluteNormal() {
        Random random = new Random(42);
        for (int i = 0; i < 20_000; i++) {
            estimator.observe(Math.abs(random.nextGaussian()));
        }
        assertEquals(1.96, estimator.estimate(0.95), 0.08);
        assertEquals(1.645, estimator.estimate(0.90), 0.08);
    }

    @Test
    @DisplayName("Estimates are monotone in q")
    void monotoneInQ() {
        Random random = new Random(3);
        for (int i = 0; i < 5_000; i++) {
            estimator.observe(random.nextGaussian() * 3.0);
        }
        double previous = Double.NEGATIVE_INFINITY;
        for (double q = 0.0; q <= 1.0; q += 0.01) {
            double current = estimator.estimate(q);
            assertTrue(current >= previous, "estimate dropped at q=" + q);
            previous = current;
        }
    }

    @Test
    @DisplayName("Restored estimator continues exactly where the original left off")
    void restoreContinuesIdentically() {
        Random random = new Random(11);
        for (int i = 0; i < 500; i++) {
            estimator.observe(random.nextGaussian());
        }
        QuantileState state = estimator.snapshot();
        QuantileEstimator resumed = new QuantileEstimator(QuantileConfig.defaults());
        resumed.restore(state);

        for (int i = 0; i < 200; i++) {
            double x = random.nextGaussian();
            estimator.observe(x);
            resumed.observe(x);
        }
        assertEquals(estimator.count(), resumed.count());
        assertEquals(estimator.estimate(0.9), resumed.estimate(0.9), 0.0);
        assertEquals(estimator.estimate(0.5), resumed.estimate(0.5), 0.0);
    }

    @Test
    @DisplayName("Malformed snapshot leaves a fresh estimator")
    void malformedSnapshotResets() {
        estimator.observe(1.0);
        estimator.restore(new QuantileState(500, null, new double[]{1, 2}, new double[]{1, 2}, new double[]{1, 2}));
        assertEquals(0, estimator.count());
        assertEquals(1.645, estimator.estimate(0.5), 0.0);
    }

    @Test
    @DisplayName("Rejects a warm-up shorter than the marker grid")
    void rejectsShortWarmup() {
        QuantileConfig config = new QuantileConfig(10, List.of(0.5, 0.9, 0.95, 0.99), 1.645);
        assertThrows(IllegalArgumentException.class, () -> new QuantileEstimator(config));
    }
}
