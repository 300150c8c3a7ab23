package in.riskgov.infrastructure.metrics;

import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.acceptance.PostureTransition;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.governance.LifecycleStatus;
import in.riskgov.domain.governance.SequentialDecision;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of RiskMetrics.
 *
 * Key Metrics:
 * - riskgov_decisions_total{profile, posture} - Cycle postures
 * - riskgov_posture_transitions_total{profile, transition} - FSM transitions
 * - riskgov_guard_violations_total{profile, guard, severity} - Guard breaches by type
 * - riskgov_blocks_total{profile, reason} - Zero-notional cycles by reason
 * - riskgov_alpha_current / riskgov_coverage_ema{profile} - Calibration gauges
 * - riskgov_governance_decisions_total{profile, decision} - Sequential test outcomes
 * - riskgov_alpha_spent_cumulative{profile} - Global alpha ledger total
 *
 * Usage:
 * <pre>
 * PrometheusRiskMetrics metrics = new PrometheusRiskMetrics(registry, "prod");
 * Undertow.builder().setHandler(new PrometheusMetricsHandler(metrics.getRegistry()))...
 * </pre>
 */
public class PrometheusRiskMetrics implements RiskMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRiskMetrics.class);

    private final CollectorRegistry registry;
    private final String profile;

    // Acceptance
    private final Counter decisionCounter;
    private final Counter transitionCounter;
    private final Counter guardViolationCounter;
    private final Counter blockCounter;
    private final Counter staleCounter;

    // Calibration and uncertainty
    private final Gauge alphaCurrent;
    private final Gauge coverageEma;
    private final Gauge kappa;
    private final Gauge kappaPlus;
    private final Histogram latency;
    private final Histogram surprisal;
    private final Histogram relativeWidth;

    // Governance
    private final Counter governanceDecisionCounter;
    private final Counter alphaSpendCounter;
    private final Gauge alphaCumulative;
    private final Counter alphaDeniedCounter;
    private final Counter lifecycleCounter;

    // Persistence
    private final Counter snapshotWriteCounter;

    public PrometheusRiskMetrics(String profile) {
        this(CollectorRegistry.defaultRegistry, profile);
    }

    public PrometheusRiskMetrics(CollectorRegistry registry, String profile) {
        this.registry = registry;
        this.profile = profile;

        this.decisionCounter = Counter.build()
            .name("riskgov_decisions_total")
            .help("Decision cycles by resulting posture")
            .labelNames("profile", "posture")
            .register(registry);

        this.transitionCounter = Counter.build()
            .name("riskgov_posture_transitions_total")
            .help("Posture transitions of the acceptance state machine")
            .labelNames("profile", "transition")
            .register(registry);

        this.guardViolationCounter = Counter.build()
            .name("riskgov_guard_violations_total")
            .help("Guard threshold breaches by guard and severity")
            .labelNames("profile", "guard", "severity")
            .register(registry);

        this.blockCounter = Counter.build()
            .name("riskgov_blocks_total")
            .help("Cycles with zero notional by block reason")
            .labelNames("profile", "reason")
            .register(registry);

        this.staleCounter = Counter.build()
            .name("riskgov_stale_decisions_total")
            .help("Cycles over budget that returned the previous decision")
            .labelNames("profile")
            .register(registry);

        this.alphaCurrent = Gauge.build()
            .name("riskgov_alpha_current")
            .help("Miscoverage level used for the latest interval")
            .labelNames("profile")
            .register(registry);

        this.coverageEma = Gauge.build()
            .name("riskgov_coverage_ema")
            .help("Exponential moving average of interval coverage")
            .labelNames("profile")
            .register(registry);

        this.kappa = Gauge.build()
            .name("riskgov_kappa")
            .help("Latest composite uncertainty score")
            .labelNames("profile")
            .register(registry);

        this.kappaPlus = Gauge.build()
            .name("riskgov_kappa_plus")
            .help("Latest coverage-adjusted uncertainty score")
            .labelNames("profile")
            .register(registry);

        this.latency = Histogram.build()
            .name("riskgov_cycle_latency_ms")
            .help("Upstream cycle latency in milliseconds")
            .labelNames("profile")
            .buckets(5, 10, 25, 50, 100, 150, 250, 500, 1000)
            .register(registry);

        this.surprisal = Histogram.build()
            .name("riskgov_surprisal")
            .help("Robust surprisal of realised values")
            .labelNames("profile")
            .buckets(0.25, 0.5, 1.0, 1.5, 2.0, 2.4, 3.2, 4.0, 6.0)
            .register(registry);

        this.relativeWidth = Histogram.build()
            .name("riskgov_relative_interval_width")
            .help("Interval width relative to the point forecast")
            .labelNames("profile")
            .buckets(0.001, 0.005, 0.01, 0.02, 0.05, 0.1, 0.25)
            .register(registry);

        this.governanceDecisionCounter = Counter.build()
            .name("riskgov_governance_decisions_total")
            .help("Sequential test outcomes")
            .labelNames("profile", "decision")
            .register(registry);

        this.alphaSpendCounter = Counter.build()
            .name("riskgov_alpha_allocations_total")
            .help("Alpha allocations granted to sequential tests")
            .labelNames("profile")
            .register(registry);

        this.alphaCumulative = Gauge.build()
            .name("riskgov_alpha_spent_cumulative")
            .help("Cumulative alpha spent from the global budget")
            .labelNames("profile")
            .register(registry);

        this.alphaDeniedCounter = Counter.build()
            .name("riskgov_alpha_denied_total")
            .help("Sequential tests refused an allocation")
            .labelNames("profile")
            .register(registry);

        this.lifecycleCounter = Counter.build()
            .name("riskgov_lifecycle_transitions_total")
            .help("Policy lifecycle transitions by target status")
            .labelNames("profile", "status")
            .register(registry);

        this.snapshotWriteCounter = Counter.build()
            .name("riskgov_snapshot_writes_total")
            .help("Snapshot write attempts")
            .labelNames("profile", "status")
            .register(registry);

        log.info("[PrometheusRiskMetrics] Registered risk metrics for profile {}", profile);
    }

    @Override
    public void recordDecision(Posture posture) {
        decisionCounter.labels(profile, posture.name()).inc();
    }

    @Override
    public void recordTransition(PostureTransition transition) {
        transitionCounter.labels(profile, transition.metricLabel()).inc();
    }

    @Override
    public void recordGuardViolation(GuardKind guard, boolean hard) {
        guardViolationCounter.labels(profile, guard.label(), hard ? "hard" : "soft").inc();
    }

    @Override
    public void recordBlock(BlockReason reason) {
        blockCounter.labels(profile, reason.metricLabel()).inc();
    }

    @Override
    public void recordStaleDecision() {
        staleCounter.labels(profile).inc();
    }

    @Override
    public void updateCalibration(double currentAlpha, double coverage) {
        alphaCurrent.labels(profile).set(currentAlpha);
        coverageEma.labels(profile).set(coverage);
    }

    @Override
    public void updateUncertainty(double kappaValue, double kappaPlusValue) {
        kappa.labels(profile).set(kappaValue);
        kappaPlus.labels(profile).set(kappaPlusValue);
    }

    @Override
    public void observeLatency(double latencyMs) {
        if (Double.isFinite(latencyMs)) {
            latency.labels(profile).observe(latencyMs);
        }
    }

    @Override
    public void observeSurprisal(double value) {
        if (Double.isFinite(value)) {
            surprisal.labels(profile).observe(value);
        }
    }

    @Override
    public void observeRelativeWidth(double value) {
        if (Double.isFinite(value)) {
            relativeWidth.labels(profile).observe(value);
        }
    }

    @Override
    public void recordGovernanceDecision(SequentialDecision decision) {
        governanceDecisionCounter.labels(profile, decision.name()).inc();
    }

    @Override
    public void recordAlphaSpend(double amount, double cumulative) {
        alphaSpendCounter.labels(profile).inc();
        alphaCumulative.labels(profile).set(cumulative);
    }

    @Override
    public void recordAlphaDenied() {
        alphaDeniedCounter.labels(profile).inc();
    }

    @Override
    public void recordLifecycleTransition(LifecycleStatus to) {
        lifecycleCounter.labels(profile, to.name()).inc();
    }

    @Override
    public void recordSnapshotWrite(boolean success) {
        snapshotWriteCounter.labels(profile, success ? "success" : "failure").inc();
    }

    /**
     * Get Prometheus registry for exposing metrics.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
