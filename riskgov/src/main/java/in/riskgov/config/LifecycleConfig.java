package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.require;

/**
 * Policy lifecycle settings.
 */
public record LifecycleConfig(
    @JsonProperty("canaryFraction")
    double canaryFraction,      // share of gated notional a CANARY policy may trade

    @JsonProperty("auditCapacity")
    int auditCapacity           // lifecycle events kept in memory
) {
    public static LifecycleConfig defaults() {
        return new LifecycleConfig(0.1, 10_000);
    }

    public void validate() {
        require(canaryFraction > 0.0 && canaryFraction <= 1.0, "lifecycle.canaryFraction", "must lie in (0, 1]");
        require(auditCapacity >= 1, "lifecycle.auditCapacity", "must be at least 1");
    }
}
