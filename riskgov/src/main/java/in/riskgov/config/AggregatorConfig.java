package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requirePositive;
import static in.riskgov.config.ConfigChecks.requireUnit;

/**
 * Uncertainty aggregation weights and references.
 */
public record AggregatorConfig(
    @JsonProperty("weightState")
    double weightState,

    @JsonProperty("weightModel")
    double weightModel,

    @JsonProperty("weightForecast")
    double weightForecast,

    @JsonProperty("gamma")
    double gamma,               // kappa_plus blend; validated offline, not tuned here

    @JsonProperty("widthRefScale")
    double widthRefScale,       // c_ref in w_ref = c_ref * max(|point|, 1) + beta_ref

    @JsonProperty("widthRefOffset")
    double widthRefOffset,      // beta_ref

    @JsonProperty("modelNeutral")
    double modelNeutral,        // model_u when no confidence vector is supplied

    @JsonProperty("coverageTolerance")
    double coverageTolerance,

    @JsonProperty("missStreakRef")
    int missStreakRef,

    @JsonProperty("bccWindow")
    int bccWindow,

    @JsonProperty("bccEmaBeta")
    double bccEmaBeta,

    @JsonProperty("bccWindowWeight")
    double bccWindowWeight
) {
    public static AggregatorConfig defaults() {
        return new AggregatorConfig(
            0.4, 0.2, 0.4,
            0.7,
            0.02, 0.0,
            0.5,
            0.05, 12,
            200, 0.01, 0.5
        );
    }

    public void validate() {
        requireUnit(weightState, "aggregator.weightState");
        requireUnit(weightModel, "aggregator.weightModel");
        requireUnit(weightForecast, "aggregator.weightForecast");
        require(Math.abs(weightState + weightModel + weightForecast - 1.0) < 1e-9, "aggregator.weights",
            "must sum to 1");
        requireUnit(gamma, "aggregator.gamma");
        requirePositive(widthRefScale, "aggregator.widthRefScale");
        require(widthRefOffset >= 0.0, "aggregator.widthRefOffset", "must be non-negative");
        requireUnit(modelNeutral, "aggregator.modelNeutral");
        requirePositive(coverageTolerance, "aggregator.coverageTolerance");
        require(missStreakRef >= 1, "aggregator.missStreakRef", "must be at least 1");
        require(bccWindow >= 1, "aggregator.bccWindow", "must be at least 1");
        require(bccEmaBeta > 0.0 && bccEmaBeta < 1.0, "aggregator.bccEmaBeta", "must lie in (0, 1)");
        requireUnit(bccWindowWeight, "aggregator.bccWindowWeight");
    }
}
