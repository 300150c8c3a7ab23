package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.requireNonNull;

/**
 * Complete engine configuration. Every section has defaults; a JSON file only
 * needs to carry the values it overrides.
 */
public record EngineConfig(
    @JsonProperty("quantile")
    QuantileConfig quantile,

    @JsonProperty("calibration")
    CalibrationConfig calibration,

    @JsonProperty("aggregator")
    AggregatorConfig aggregator,

    @JsonProperty("acceptance")
    AcceptanceConfig acceptance,

    @JsonProperty("gate")
    GateConfig gate,

    @JsonProperty("ledger")
    LedgerConfig ledger,

    @JsonProperty("sequential")
    SequentialTestConfig sequential,

    @JsonProperty("lifecycle")
    LifecycleConfig lifecycle,

    @JsonProperty("stream")
    StreamConfig stream,

    @JsonProperty("persistence")
    PersistenceConfig persistence,

    @JsonProperty("metrics")
    MetricsConfig metrics
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
            QuantileConfig.defaults(),
            CalibrationConfig.defaults(),
            AggregatorConfig.defaults(),
            AcceptanceConfig.defaults(),
            GateConfig.defaults(),
            LedgerConfig.defaults(),
            SequentialTestConfig.defaults(),
            LifecycleConfig.defaults(),
            StreamConfig.defaults(),
            PersistenceConfig.defaults(),
            MetricsConfig.defaults()
        );
    }

    public EngineConfig withAcceptance(AcceptanceConfig value) {
        return new EngineConfig(quantile, calibration, aggregator, value, gate, ledger, sequential,
            lifecycle, stream, persistence, metrics);
    }

    public EngineConfig withLedger(LedgerConfig value) {
        return new EngineConfig(quantile, calibration, aggregator, acceptance, gate, value, sequential,
            lifecycle, stream, persistence, metrics);
    }

    public EngineConfig withSequential(SequentialTestConfig value) {
        return new EngineConfig(quantile, calibration, aggregator, acceptance, gate, ledger, value,
            lifecycle, stream, persistence, metrics);
    }

    public EngineConfig withStream(StreamConfig value) {
        return new EngineConfig(quantile, calibration, aggregator, acceptance, gate, ledger, sequential,
            lifecycle, value, persistence, metrics);
    }

    public EngineConfig withPersistence(PersistenceConfig value) {
        return new EngineConfig(quantile, calibration, aggregator, acceptance, gate, ledger, sequential,
            lifecycle, stream, value, metrics);
    }

    public EngineConfig withMetrics(MetricsConfig value) {
        return new EngineConfig(quantile, calibration, aggregator, acceptance, gate, ledger, sequential,
            lifecycle, stream, persistence, value);
    }

    /**
     * @throws in.riskgov.domain.common.ConfigurationException on the first invalid value
     */
    public void validate() {
        requireNonNull(quantile, "quantile");
        requireNonNull(calibration, "calibration");
        requireNonNull(aggregator, "aggregator");
        requireNonNull(acceptance, "acceptance");
        requireNonNull(gate, "gate");
        requireNonNull(ledger, "ledger");
        requireNonNull(sequential, "sequential");
        requireNonNull(lifecycle, "lifecycle");
        requireNonNull(stream, "stream");
        requireNonNull(persistence, "persistence");
        requireNonNull(metrics, "metrics");
        quantile.validate();
        calibration.validate();
        aggregator.validate();
        acceptance.validate();
        gate.validate();
        ledger.validate();
        sequential.validate();
        lifecycle.validate();
        stream.validate();
        persistence.validate();
        metrics.validate();
    }
}
