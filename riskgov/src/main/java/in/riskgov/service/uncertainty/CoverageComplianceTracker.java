package in.riskgov.service.uncertainty;

import in.riskgov.config.AggregatorConfig;
import in.riskgov.domain.snapshot.CoverageTrackerState;

import java.util.Arrays;

/**
 * Rolling blended coverage compliance (BCC): a blend of the hit rate over a fixed
 * window and a hit-rate EMA, relative to nominal coverage. 1.0 means the stream
 * covers at least as often as it should.
 */
public final class CoverageComplianceTracker {

    private final double nominalCoverage;
    private final double emaBeta;
    private final double windowWeight;
    private final boolean[] window;

    private int head;
    private int size;
    private int hitsInWindow;
    private double ema;
    private long observations;

    public CoverageComplianceTracker(AggregatorConfig config, double nominalCoverage) {
        if (nominalCoverage <= 0.0 || nominalCoverage > 1.0) {
            throw new IllegalArgumentException("nominal coverage must lie in (0, 1], got " + nominalCoverage);
        }
        this.nominalCoverage = nominalCoverage;
        this.emaBeta = config.bccEmaBeta();
        this.windowWeight = config.bccWindowWeight();
        this.window = new boolean[config.bccWindow()];
        this.ema = nominalCoverage;
    }

    public void update(boolean hit) {
        if (size == window.length) {
            if (window[head]) {
                hitsInWindow--;
            }
        } else {
            size++;
        }
        window[head] = hit;
        if (hit) {
            hitsInWindow++;
        }
        head = (head + 1) % window.length;
        ema = (1.0 - emaBeta) * ema + emaBeta * (hit ? 1.0 : 0.0);
        observations++;
    }

    /**
     * @return BCC in [0, 1]; 1.0 before the first observation
     */
    public double estimate() {
        if (observations == 0) {
            return 1.0;
        }
        double windowRate = (double) hitsInWindow / size;
        double blended = windowWeight * windowRate + (1.0 - windowWeight) * ema;
        return Math.max(0.0, Math.min(1.0, blended / nominalCoverage));
    }

    public CoverageTrackerState snapshot() {
        int[] ordered = new int[size];
        int start = size == window.length ? head : 0;
        for (int i = 0; i < size; i++) {
            ordered[i] = window[(start + i) % window.length] ? 1 : 0;
        }
        return new CoverageTrackerState(ordered, ema, observations);
    }

    public void restore(CoverageTrackerState state) {
        head = 0;
        size = 0;
        hitsInWindow = 0;
        Arrays.fill(window, false);
        ema = nominalCoverage;
        observations = 0;
        if (state == null) {
            return;
        }
        if (state.window() != null) {
            int[] values = state.window();
            int from = Math.max(0, values.length - window.length);
            for (int i = from; i < values.length; i++) {
                boolean hit = values[i] == 1;
                window[head] = hit;
                if (hit) {
                    hitsInWindow++;
                }
                head = (head + 1) % window.length;
                size++;
            }
        }
        if (Double.isFinite(state.ema()) && state.ema() >= 0.0 && state.ema() <= 1.0) {
            ema = state.ema();
        }
        observations = Math.max(state.observations(), size);
    }
}
