package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.riskgov.domain.governance.LikelihoodKind;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requireNonNull;
import static in.riskgov.config.ConfigChecks.requirePositive;
import static in.riskgov.config.ConfigChecks.requireProbability;

/**
 * Sequential probability ratio test settings. H0: mean = mu0, H1: mean = mu1.
 */
public record SequentialTestConfig(
    @JsonProperty("beta")
    double beta,                // type II error

    @JsonProperty("mu0")
    double mu0,

    @JsonProperty("mu1")
    double mu1,

    @JsonProperty("sigma")
    double sigma,               // known sigma, or the prior for the unknown-variance model

    @JsonProperty("likelihood")
    LikelihoodKind likelihood,

    @JsonProperty("minSamples")
    int minSamples,

    @JsonProperty("maxSamples")
    int maxSamples              // 0 disables truncation
) {
    public static SequentialTestConfig defaults() {
        return new SequentialTestConfig(0.2, 0.0, 0.5, 1.0, LikelihoodKind.GAUSSIAN, 10, 0);
    }

    public void validate() {
        requireProbability(beta, "sequential.beta");
        require(Double.isFinite(mu0) && Double.isFinite(mu1), "sequential.mu", "must be finite");
        require(mu0 != mu1, "sequential.mu1", "must differ from mu0");
        requirePositive(sigma, "sequential.sigma");
        requireNonNull(likelihood, "sequential.likelihood");
        require(minSamples >= 1, "sequential.minSamples", "must be at least 1");
        require(maxSamples == 0 || maxSamples >= minSamples, "sequential.maxSamples",
            "must be 0 or at least minSamples");
    }
}
