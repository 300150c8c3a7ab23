package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requireNonNull;

/**
 * Streaming quantile estimator settings.
 */
public record QuantileConfig(
    @JsonProperty("warmupSamples")
    int warmupSamples,              // exact sorted buffer below this count

    @JsonProperty("markerProbabilities")
    List<Double> markerProbabilities, // target probabilities tracked by markers after warm-up

    @JsonProperty("safeDefault")
    double safeDefault              // returned before the first observation
) {
    public static QuantileConfig defaults() {
        return new QuantileConfig(
            100,
            List.of(0.5, 0.7, 0.75, 0.8, 0.85, 0.875, 0.9, 0.925, 0.95, 0.975, 0.99),
            1.645
        );
    }

    public int markerCount() {
        return 2 * markerProbabilities.size() + 3;
    }

    public void validate() {
        requireNonNull(markerProbabilities, "quantile.markerProbabilities");
        require(!markerProbabilities.isEmpty(), "quantile.markerProbabilities", "must not be empty");
        double previous = 0.0;
        for (Double p : markerProbabilities) {
            require(p != null && p > previous && p < 1.0, "quantile.markerProbabilities",
                "must be strictly increasing inside (0, 1)");
            previous = p;
        }
        require(warmupSamples >= markerCount(), "quantile.warmupSamples",
            "must be at least the marker count " + markerCount());
        require(Double.isFinite(safeDefault), "quantile.safeDefault", "must be finite");
    }
}
