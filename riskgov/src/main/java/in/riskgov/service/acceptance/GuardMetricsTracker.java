package in.riskgov.service.acceptance;

import in.riskgov.config.AcceptanceConfig;
import in.riskgov.domain.snapshot.GuardWindowState;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Rolling windows behind the latency and surprisal guards. The p95 is taken after
 * winsorising the window at the configured tails, which keeps a single wild
 * sample from dominating a short window.
 */
public final class GuardMetricsTracker {

    private static final double P95 = 0.95;

    private final int latencyCapacity;
    private final int surprisalCapacity;
    private final double winsorLower;
    private final double winsorUpper;
    private final Deque<Double> latencies = new ArrayDeque<>();
    private final Deque<Double> surprisals = new ArrayDeque<>();

    public GuardMetricsTracker(AcceptanceConfig config) {
        this.latencyCapacity = config.latencyWindow();
        this.surprisalCapacity = config.surprisalWindow();
        this.winsorLower = config.winsorLower();
        this.winsorUpper = config.winsorUpper();
    }

    public void recordLatency(double latencyMs) {
        if (Double.isFinite(latencyMs) && latencyMs >= 0.0) {
            push(latencies, latencyMs, latencyCapacity);
        }
    }

    public void recordSurprisal(double surprisal) {
        if (Double.isFinite(surprisal)) {
            push(surprisals, surprisal, surprisalCapacity);
        }
    }

    /**
     * @return NaN until a latency has been recorded
     */
    public double latencyP95() {
        return winsorizedQuantile(latencies, P95);
    }

    /**
     * @return NaN until a surprisal has been recorded
     */
    public double surprisalP95() {
        return winsorizedQuantile(surprisals, P95);
    }

    public GuardWindowState snapshot() {
        return new GuardWindowState(toArray(latencies), toArray(surprisals));
    }

    public void restore(GuardWindowState state) {
        latencies.clear();
        surprisals.clear();
        if (state == null) {
            return;
        }
        if (state.latencies() != null) {
            for (double v : state.latencies()) {
                recordLatency(v);
            }
        }
        if (state.surprisals() != null) {
            for (double v : state.surprisals()) {
                recordSurprisal(v);
            }
        }
    }

    private double winsorizedQuantile(Deque<Double> window, double q) {
        if (window.isEmpty()) {
            return Double.NaN;
        }
        double[] sorted = toArray(window);
        Arrays.sort(sorted);
        double lo = quantile(sorted, winsorLower);
        double hi = quantile(sorted, winsorUpper);
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = Math.max(lo, Math.min(hi, sorted[i]));
        }
        return quantile(sorted, q);
    }

    private static double quantile(double[] sorted, double q) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }

    private static void push(Deque<Double> window, double value, int capacity) {
        window.addLast(value);
        while (window.size() > capacity) {
            window.removeFirst();
        }
    }

    private static double[] toArray(Deque<Double> window) {
        return window.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
