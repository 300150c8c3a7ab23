package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Persisted state of a streaming quantile estimator. Marker arrays are null while
 * the estimator is still in its exact warm-up phase.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuantileState(
    long count,
    double[] warmup,
    double[] heights,
    double[] positions,
    double[] desired
) {
}
