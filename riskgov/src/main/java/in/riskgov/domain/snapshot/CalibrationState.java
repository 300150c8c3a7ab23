package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Calibrator state. {@code alphaTarget} is the controller-adapted base level,
 * {@code currentAlpha} the level used for the latest interval.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalibrationState(
    double currentAlpha,
    double alphaTarget,
    double coverageEma,
    int missStreak,
    QuantileState quantileEstimatorState,
    double inflationFactor,
    int cooldownCounter,
    long observations
) {
}
