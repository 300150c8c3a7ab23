package in.riskgov.domain.governance;

import java.time.Instant;

/**
 * Running mean and variance of a policy's metric (Welford).
 */
public record RollingMetrics(long count, double mean, double m2, double lastValue, Instant lastTimestamp) {

    public static RollingMetrics empty() {
        return new RollingMetrics(0, 0.0, 0.0, Double.NaN, null);
    }

    public RollingMetrics update(double value, Instant at) {
        long n = count + 1;
        double delta = value - mean;
        double newMean = mean + delta / n;
        double newM2 = m2 + delta * (value - newMean);
        return new RollingMetrics(n, newMean, newM2, value, at);
    }

    public double variance() {
        return count > 1 ? m2 / (count - 1) : 0.0;
    }
}
