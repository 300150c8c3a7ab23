package in.riskgov.service.calibration;

import in.riskgov.config.QuantileConfig;
import in.riskgov.domain.snapshot.QuantileState;

import java.util.Arrays;
import java.util.List;

/**
 * Streaming quantile estimator with bounded memory.
 *
 * Below the warm-up count the estimate is the exact, linearly interpolated
 * empirical quantile of a sorted buffer. Once the buffer is full the estimator
 * switches, permanently, to extended P² markers seeded from that buffer. Each
 * configured probability p gets a marker, with midpoint markers between
 * neighbours and the extremes, 2m+3 markers in total.
 *
 * Not thread-safe; owned by a single calibrator.
 */
public final class QuantileEstimator {

    private final int warmupSamples;
    private final double safeDefault;
    private final double[] probabilities;   // marker target probabilities, 0 and 1 at the ends

    private double[] warmup;
    private int warmupSize;
    private long count;

    private double[] heights;
    private double[] positions;
    private double[] desired;

    public QuantileEstimator(QuantileConfig config) {
        this.warmupSamples = config.warmupSamples();
        this.safeDefault = config.safeDefault();
        this.probabilities = markerProbabilities(config.markerProbabilities());
        if (warmupSamples < probabilities.length) {
            throw new IllegalArgumentException("warmupSamples " + warmupSamples
                + " smaller than marker count " + probabilities.length);
        }
        this.warmup = new double[warmupSamples];
    }

    /**
     * Add one value. Non-finite values are ignored.
     */
    public void observe(double value) {
        if (!Double.isFinite(value)) {
            return;
        }
        count++;
        if (heights == null) {
            insertSorted(value);
            if (warmupSize == warmupSamples) {
                seedMarkers();
            }
            return;
        }
        updateMarkers(value);
    }

    /**
     * Estimate the q-quantile; q is clipped to [0, 1].
     *
     * @return the configured safe default before any observation
     */
    public double estimate(double q) {
        if (count == 0) {
            return safeDefault;
        }
        double p = Math.max(0.0, Math.min(1.0, q));
        if (heights == null) {
            return sortedQuantile(warmup, warmupSize, p);
        }
        int last = probabilities.length - 1;
        if (p <= probabilities[0]) {
            return heights[0];
        }
        for (int i = 1; i <= last; i++) {
            if (p <= probabilities[i]) {
                double span = probabilities[i] - probabilities[i - 1];
                double t = span > 0 ? (p - probabilities[i - 1]) / span : 1.0;
                return heights[i - 1] + t * (heights[i] - heights[i - 1]);
            }
        }
        return heights[last];
    }

    public long count() {
        return count;
    }

    public boolean isWarm() {
        return heights != null;
    }

    public QuantileState snapshot() {
        return new QuantileState(
            count,
            Arrays.copyOf(warmup, warmupSize),
            heights == null ? null : heights.clone(),
            positions == null ? null : positions.clone(),
            desired == null ? null : desired.clone());
    }

    /**
     * Replace the current state. A null or malformed snapshot leaves a fresh estimator.
     */
    public void restore(QuantileState state) {
        reset();
        if (state == null) {
            return;
        }
        int markers = probabilities.length;
        if (state.heights() != null) {
            if (state.heights().length != markers || state.positions() == null
                || state.positions().length != markers || state.desired() == null
                || state.desired().length != markers) {
                return;
            }
            heights = state.heights().clone();
            positions = state.positions().clone();
            desired = state.desired().clone();
            count = state.count();
            return;
        }
        if (state.warmup() != null) {
            for (double v : state.warmup()) {
                observe(v);
            }
        }
    }

    private void reset() {
        warmup = new double[warmupSamples];
        warmupSize = 0;
        count = 0;
        heights = null;
        positions = null;
        desired = null;
    }

    private void insertSorted(double value) {
        int idx = Arrays.binarySearch(warmup, 0, warmupSize, value);
        if (idx < 0) {
            idx = -idx - 1;
        }
        System.arraycopy(warmup, idx, warmup, idx + 1, warmupSize - idx);
        warmup[idx] = value;
        warmupSize++;
    }

    private void seedMarkers() {
        int markers = probabilities.length;
        int n = warmupSize;
        heights = new double[markers];
        positions = new double[markers];
        desired = new double[markers];

        // positions are 1-based ranks into the sorted buffer and must be strictly increasing
        int[] ranks = new int[markers];
        for (int i = 0; i < markers; i++) {
            ranks[i] = 1 + (int) Math.round(probabilities[i] * (n - 1));
        }
        ranks[0] = 1;
        for (int i = 1; i < markers; i++) {
            ranks[i] = Math.max(ranks[i], ranks[i - 1] + 1);
        }
        ranks[markers - 1] = n;
        for (int i = markers - 2; i >= 0; i--) {
            ranks[i] = Math.min(ranks[i], ranks[i + 1] - 1);
        }

        for (int i = 0; i < markers; i++) {
            positions[i] = ranks[i];
            heights[i] = warmup[ranks[i] - 1];
            desired[i] = 1 + probabilities[i] * (n - 1);
        }
        warmup = new double[0];
        warmupSize = 0;
    }

    private void updateMarkers(double x) {
        int last = heights.length - 1;
        int cell;
        if (x < heights[0]) {
            heights[0] = x;
            cell = 0;
        } else if (x >= heights[last]) {
            heights[last] = x;
            cell = last - 1;
        } else {
            cell = 0;
            while (cell < last - 1 && x >= heights[cell + 1]) {
                cell++;
            }
        }

        for (int i = cell + 1; i <= last; i++) {
            positions[i] += 1;
        }
        for (int i = 0; i <= last; i++) {
            desired[i] += probabilities[i];
        }

        for (int i = 1; i < last; i++) {
            double d = desired[i] - positions[i];
            if ((d >= 1 && positions[i + 1] - positions[i] > 1)
                || (d <= -1 && positions[i - 1] - positions[i] < -1)) {
                int step = d > 0 ? 1 : -1;
                double candidate = parabolic(i, step);
                if (heights[i - 1] < candidate && candidate < heights[i + 1]) {
                    heights[i] = candidate;
                } else {
                    heights[i] = linear(i, step);
                }
                positions[i] += step;
            }
        }
    }

    private double parabolic(int i, int d) {
        double nPrev = positions[i - 1];
        double n = positions[i];
        double nNext = positions[i + 1];
        return heights[i] + d / (nNext - nPrev) * (
            (n - nPrev + d) * (heights[i + 1] - heights[i]) / (nNext - n)
                + (nNext - n - d) * (heights[i] - heights[i - 1]) / (n - nPrev));
    }

    private double linear(int i, int d) {
        return heights[i] + d * (heights[i + d] - heights[i]) / (positions[i + d] - positions[i]);
    }

    static double sortedQuantile(double[] sorted, int size, double p) {
        if (size == 1) {
            return sorted[0];
        }
        double pos = p * (size - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, size - 1);
        double frac = pos - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    private static double[] markerProbabilities(List<Double> targets) {
        int m = targets.size();
        double[] grid = new double[2 * m + 3];
        int k = 0;
        grid[k++] = 0.0;
        grid[k++] = targets.get(0) / 2.0;
        for (int i = 0; i < m; i++) {
            grid[k++] = targets.get(i);
            double next = i + 1 < m ? targets.get(i + 1) : 1.0;
            grid[k++] = (targets.get(i) + next) / 2.0;
        }
        grid[k] = 1.0;
        return grid;
    }
}
