package in.riskgov.domain.acceptance;

/**
 * The fixed, ordered guard set. Declaration order is the evaluation order and the
 * order used to pick a block reason when several guards breach at once.
 */
public enum GuardKind {
    COVERAGE_EMA("coverage_ema", true),
    COVERAGE_MISS_STREAK("coverage_miss_streak", false),
    LATENCY_P95("latency_p95_ms", false),
    SURPRISAL_P95("surprisal_p95", false),
    RELATIVE_INTERVAL_WIDTH("relative_interval_width", false),
    KAPPA("kappa", false),
    KAPPA_PLUS("kappa_plus", false);

    private final String label;
    private final boolean lowerBound;

    GuardKind(String label, boolean lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String label() {
        return label;
    }

    /**
     * True when the guard trips on values falling below the threshold.
     */
    public boolean isLowerBound() {
        return lowerBound;
    }

    /**
     * NaN is treated as "not yet measured" and never breaches.
     */
    public boolean breaches(double value, double threshold) {
        if (Double.isNaN(value)) {
            return false;
        }
        return lowerBound ? value < threshold : value > threshold;
    }
}
