package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.require;

/**
 * Per decision stream runtime settings.
 */
public record StreamConfig(
    @JsonProperty("cycleBudgetMs")
    long cycleBudgetMs,         // compute budget of one cycle; over budget -> stale decision

    @JsonProperty("snapshotEveryCycles")
    int snapshotEveryCycles,

    @JsonProperty("pendingCapacity")
    int pendingCapacity         // forecasts awaiting ground truth
) {
    public static StreamConfig defaults() {
        return new StreamConfig(50, 100, 1024);
    }

    public void validate() {
        require(cycleBudgetMs >= 1, "stream.cycleBudgetMs", "must be at least 1");
        require(snapshotEveryCycles >= 1, "stream.snapshotEveryCycles", "must be at least 1");
        require(pendingCapacity >= 1, "stream.pendingCapacity", "must be at least 1");
    }
}
