package in.riskgov.service.acceptance;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurprisalTest {

    private static final double DELTA = 1.345;

    @Test
    void huberIsQuadraticInsideDelta() {
        assertEquals(0.5, Surprisal.huber(1.0, DELTA), 1e-12);
        assertEquals(0.5, Surprisal.huber(-1.0, DELTA), 1e-12);
    }

    @Test
    void huberIsLinearOutsideDelta() {
        assertEquals(DELTA * (3.0 - 0.5 * DELTA), Surprisal.huber(3.0, DELTA), 1e-12);
        assertEquals(Surprisal.huber(3.0, DELTA), Surprisal.huber(-3.0, DELTA), 1e-12);
    }

    @Test
    void exactForecastHasZeroSurprisal() {
        assertEquals(0.0, Surprisal.of(100.0, 100.0, 1.0, DELTA), 0.0);
    }

    @Test
    void surprisalUsesStandardisedResidual() {
        double expected = Math.log1p(3.0 * DELTA * (2.0 - 0.5 * DELTA));
        assertEquals(expected, Surprisal.of(104.0, 100.0, 2.0, DELTA), 1e-12);
    }

    @Test
    void undefinedWithoutPositiveSigma() {
        assertTrue(Double.isNaN(Surprisal.of(101.0, 100.0, 0.0, DELTA)));
        assertTrue(Double.isNaN(Surprisal.of(101.0, 100.0, Double.NaN, DELTA)));
        assertTrue(Double.isNaN(Surprisal.of(Double.NaN, 100.0, 1.0, DELTA)));
    }
}
