package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requirePositive;
import static in.riskgov.config.ConfigChecks.requireProbability;

/**
 * Adaptive conformal calibrator settings.
 */
public record CalibrationConfig(
    @JsonProperty("alphaBase")
    double alphaBase,           // nominal miscoverage; initial alpha_target

    @JsonProperty("alphaMin")
    double alphaMin,

    @JsonProperty("alphaMax")
    double alphaMax,

    @JsonProperty("transitionPremium")
    double transitionPremium,   // a1: alpha added while the model flags a regime transition

    @JsonProperty("aciWeight")
    double aciWeight,           // a2: alpha added per unit of ACI EMA

    @JsonProperty("etaBase")
    double etaBase,

    @JsonProperty("etaTransition")
    double etaTransition,

    @JsonProperty("coverageEmaBeta")
    double coverageEmaBeta,     // EMA noise is about sqrt(beta * 0.09 / 2) at 90% coverage

    @JsonProperty("minCalibration")
    int minCalibration,         // residual scores needed before the empirical quantile is used

    @JsonProperty("zRef")
    double zRef,                // fixed score quantile used until then

    @JsonProperty("missCluster")
    int missCluster,            // consecutive misses that count as a cluster

    @JsonProperty("inflationStep")
    double inflationStep,

    @JsonProperty("inflationCeiling")
    double inflationCeiling,    // cap on total interval widening

    @JsonProperty("cooldownSteps")
    int cooldownSteps
) {
    public static CalibrationConfig defaults() {
        return new CalibrationConfig(
            0.10, 0.01, 0.30,
            0.05, 0.50,
            0.0005, 0.005,
            0.001,
            100, 1.645,
            3, 0.10, 1.25, 25
        );
    }

    public void validate() {
        requireProbability(alphaBase, "calibration.alphaBase");
        requireProbability(alphaMin, "calibration.alphaMin");
        requireProbability(alphaMax, "calibration.alphaMax");
        require(alphaMin <= alphaBase && alphaBase <= alphaMax, "calibration.alphaBase",
            "must satisfy alphaMin <= alphaBase <= alphaMax");
        require(transitionPremium >= 0.0, "calibration.transitionPremium", "must be non-negative");
        require(aciWeight >= 0.0, "calibration.aciWeight", "must be non-negative");
        requireProbability(etaBase, "calibration.etaBase");
        requireProbability(etaTransition, "calibration.etaTransition");
        requireProbability(coverageEmaBeta, "calibration.coverageEmaBeta");
        require(minCalibration >= 1, "calibration.minCalibration", "must be at least 1");
        requirePositive(zRef, "calibration.zRef");
        require(missCluster >= 1, "calibration.missCluster", "must be at least 1");
        require(inflationStep >= 0.0, "calibration.inflationStep", "must be non-negative");
        require(inflationCeiling >= 1.0, "calibration.inflationCeiling", "must be at least 1");
        require(cooldownSteps >= 0, "calibration.cooldownSteps", "must be non-negative");
    }
}
