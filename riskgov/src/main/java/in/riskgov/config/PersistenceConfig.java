package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.require;

/**
 * Snapshot write-behind settings.
 */
public record PersistenceConfig(
    @JsonProperty("snapshotDir")
    String snapshotDir,

    @JsonProperty("flushIntervalMs")
    long flushIntervalMs,

    @JsonProperty("queueCapacity")
    int queueCapacity,

    @JsonProperty("retryInitialDelayMs")
    long retryInitialDelayMs,

    @JsonProperty("retryMaxDelayMs")
    long retryMaxDelayMs,

    @JsonProperty("retryMultiplier")
    double retryMultiplier,

    @JsonProperty("retryMaxAttempts")
    int retryMaxAttempts
) {
    public static PersistenceConfig defaults() {
        return new PersistenceConfig("data/snapshots", 1000, 1024, 100, 5000, 2.0, 5);
    }

    public PersistenceConfig withSnapshotDir(String dir) {
        return new PersistenceConfig(dir, flushIntervalMs, queueCapacity, retryInitialDelayMs,
            retryMaxDelayMs, retryMultiplier, retryMaxAttempts);
    }

    public void validate() {
        require(snapshotDir != null && !snapshotDir.isBlank(), "persistence.snapshotDir", "is missing");
        require(flushIntervalMs >= 1, "persistence.flushIntervalMs", "must be at least 1");
        require(queueCapacity >= 1, "persistence.queueCapacity", "must be at least 1");
        require(retryInitialDelayMs >= 1, "persistence.retryInitialDelayMs", "must be at least 1");
        require(retryMaxDelayMs >= retryInitialDelayMs, "persistence.retryMaxDelayMs",
            "must be at least retryInitialDelayMs");
        require(retryMultiplier > 1.0, "persistence.retryMultiplier", "must be greater than 1");
        require(retryMaxAttempts >= 1, "persistence.retryMaxAttempts", "must be at least 1");
    }
}
