package in.riskgov.config;

import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.GuardThreshold;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.common.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Engine configuration validation")
class EngineConfigTest {

    private static String failingKey(EngineConfig config) {
        return assertThrows(ConfigurationException.class, config::validate).getKey();
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValidate() {
        assertDoesNotThrow(() -> EngineConfig.defaults().validate());
    }

    @Test
    @DisplayName("Misordered guard thresholds are rejected")
    void thresholdOrdering() {
        EngineConfig config = EngineConfig.defaults().withAcceptance(
            AcceptanceConfig.defaults().withThreshold(GuardKind.KAPPA, GuardThreshold.of(0.9, 0.85)));
        assertEquals("acceptance.thresholds.KAPPA", failingKey(config));

        EngineConfig coverage = EngineConfig.defaults().withAcceptance(
            AcceptanceConfig.defaults().withThreshold(GuardKind.COVERAGE_EMA, GuardThreshold.of(0.75, 0.85)));
        assertEquals("acceptance.thresholds.COVERAGE_EMA", failingKey(coverage));
    }

    @Test
    @DisplayName("The BLOCK recovery window must exceed the DERISK recovery dwell")
    void blockRecoveryWindow() {
        AcceptanceConfig d = AcceptanceConfig.defaults();
        AcceptanceConfig invalid = new AcceptanceConfig(d.thresholds(), d.dwellMinDerisk(), d.dwellMinRecovery(),
            d.blockCooldownCycles(), d.dwellMinRecovery(), d.fastRecoveryEnabled(), d.kappaPlusConfidenceFloor(),
            d.latencyWindow(), d.surprisalWindow(), d.huberDelta(), d.relativeWidthFloor(),
            d.winsorLower(), d.winsorUpper());

        assertEquals("acceptance.blockRecoveryCycles", failingKey(EngineConfig.defaults().withAcceptance(invalid)));
    }

    @Test
    @DisplayName("Aggregator weights must sum to one")
    void aggregatorWeights() {
        AggregatorConfig d = AggregatorConfig.defaults();
        AggregatorConfig invalid = new AggregatorConfig(0.5, d.weightModel(), d.weightForecast(), d.gamma(),
            d.widthRefScale(), d.widthRefOffset(), d.modelNeutral(), d.coverageTolerance(), d.missStreakRef(),
            d.bccWindow(), d.bccEmaBeta(), d.bccWindowWeight());
        EngineConfig defaults = EngineConfig.defaults();
        EngineConfig config = new EngineConfig(defaults.quantile(), defaults.calibration(), invalid,
            defaults.acceptance(), defaults.gate(), defaults.ledger(), defaults.sequential(), defaults.lifecycle(),
            defaults.stream(), defaults.persistence(), defaults.metrics());

        assertEquals("aggregator.weights", failingKey(config));
    }

    @Test
    @DisplayName("BLOCK must trade nothing")
    void blockScaleIsZero() {
        GateConfig gate = new GateConfig(Map.of(Posture.PASS, 1.0, Posture.DERISK, 0.5, Posture.BLOCK, 0.25),
            0.0, 1e9, true);
        EngineConfig defaults = EngineConfig.defaults();
        EngineConfig config = new EngineConfig(defaults.quantile(), defaults.calibration(), defaults.aggregator(),
            defaults.acceptance(), gate, defaults.ledger(), defaults.sequential(), defaults.lifecycle(),
            defaults.stream(), defaults.persistence(), defaults.metrics());

        assertEquals("gate.scaleMap.BLOCK", failingKey(config));
    }

    @Test
    @DisplayName("Ledger and sequential test settings are range checked")
    void governanceRanges() {
        LedgerConfig budget = new LedgerConfig(1.5, 20, LedgerConfig.defaults().spendingPolicy(), 10.0, 1e-12);
        assertEquals("ledger.totalBudget", failingKey(EngineConfig.defaults().withLedger(budget)));

        SequentialTestConfig d = SequentialTestConfig.defaults();
        SequentialTestConfig sameMeans = new SequentialTestConfig(d.beta(), 0.5, 0.5, d.sigma(), d.likelihood(),
            d.minSamples(), d.maxSamples());
        assertEquals("sequential.mu1", failingKey(EngineConfig.defaults().withSequential(sameMeans)));

        SequentialTestConfig truncation = new SequentialTestConfig(d.beta(), d.mu0(), d.mu1(), d.sigma(),
            d.likelihood(), 10, 5);
        assertEquals("sequential.maxSamples", failingKey(EngineConfig.defaults().withSequential(truncation)));
    }

    @Test
    @DisplayName("Missing sections are reported by name")
    void missingSection() {
        assertEquals("ledger", failingKey(EngineConfig.defaults().withLedger(null)));
        assertEquals("metrics.port", failingKey(EngineConfig.defaults().withMetrics(
            MetricsConfig.defaults().withPort(0))));
    }
}
