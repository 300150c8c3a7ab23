package in.riskgov.domain.forecast;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Calibrated interval for one forecast. Carries the inputs it was built from so a
 * later ground truth can be scored against it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntervalPrediction(
    Instant timestamp,
    double pointForecast,
    double sigmaHat,
    boolean regimeTransition,
    double lower,
    double upper,
    double alphaUsed
) {
    public IntervalPrediction {
        if (lower > upper) {
            throw new IllegalArgumentException("lower " + lower + " > upper " + upper);
        }
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }
}
