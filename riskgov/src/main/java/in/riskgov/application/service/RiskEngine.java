package in.riskgov.application.service;

import in.riskgov.application.port.input.RiskDecisionService;
import in.riskgov.application.port.output.SnapshotPublisher;
import in.riskgov.application.port.output.SnapshotStore;
import in.riskgov.config.EngineConfig;
import in.riskgov.domain.acceptance.CycleDecision;
import in.riskgov.domain.acceptance.GuardEvaluation;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.execution.ExecutionDecision;
import in.riskgov.domain.forecast.Forecast;
import in.riskgov.domain.forecast.GroundTruth;
import in.riskgov.domain.governance.GovernanceDecision;
import in.riskgov.domain.governance.PolicyMetric;
import in.riskgov.domain.governance.PolicyRecord;
import in.riskgov.domain.snapshot.GovernanceSnapshot;
import in.riskgov.domain.snapshot.StreamSnapshot;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import in.riskgov.service.execution.ExecutionRiskGate;
import in.riskgov.service.governance.AlphaSpendingLedger;
import in.riskgov.service.governance.AlphaSpendingPolicy;
import in.riskgov.service.governance.PolicyLifecycleManager;
import in.riskgov.service.uncertainty.UncertaintyAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Process-wide facade. Owns the stream registry, the alpha ledger and the policy
 * lifecycle, restores them from the snapshot store and hands new snapshots to the
 * write-behind publisher.
 */
public final class RiskEngine implements RiskDecisionService {
    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    // stream ids double as snapshot file names
    private static final Pattern STREAM_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final EngineConfig config;
    private final RiskMetrics metrics;
    private final SnapshotStore store;
    private final SnapshotPublisher publisher;
    private final Clock clock;
    private final LongSupplier nanoClock;

    private final UncertaintyAggregator aggregator;
    private final ExecutionRiskGate gate;
    private final AlphaSpendingLedger ledger;
    private final PolicyLifecycleManager lifecycle;
    private final ConcurrentMap<String, DecisionStream> streams = new ConcurrentHashMap<>();

    public RiskEngine(EngineConfig config, RiskMetrics metrics, SnapshotStore store, SnapshotPublisher publisher,
                      Clock clock, LongSupplier nanoClock) {
        this.config = config;
        this.metrics = metrics;
        this.store = store;
        this.publisher = publisher;
        this.clock = clock;
        this.nanoClock = nanoClock;
        this.aggregator = new UncertaintyAggregator(config.aggregator());
        this.gate = new ExecutionRiskGate(config.gate(), metrics);
        this.ledger = new AlphaSpendingLedger(config.ledger(), clock, metrics);
        this.lifecycle = new PolicyLifecycleManager(config.lifecycle(), config.sequential(), config.ledger(),
            ledger, AlphaSpendingPolicy.from(config.ledger()), gate, clock, metrics);
    }

    /**
     * Restore governance state and every persisted stream.
     */
    public void restore() {
        store.loadGovernance().ifPresent(snapshot -> {
            if (!GovernanceSnapshot.SCHEMA.equals(snapshot.schema())) {
                log.warn("[RiskEngine] Ignoring governance snapshot with schema {}", snapshot.schema());
                return;
            }
            ledger.restore(snapshot.ledger());
            lifecycle.restore(snapshot.lifecycle());
        });
        for (String streamId : store.listStreams()) {
            if (!STREAM_ID.matcher(streamId).matches()) {
                log.warn("[RiskEngine] Skipping snapshot with unusable stream id {}", streamId);
                continue;
            }
            stream(streamId);
        }
        log.info("[RiskEngine] Restored {} streams; alpha spent {} of {}",
            streams.size(), ledger.cumulativeAlpha(), ledger.totalBudget());
    }

    @Override
    public CycleDecision process(String streamId, Forecast forecast) {
        return stream(streamId).process(forecast);
    }

    @Override
    public boolean onGroundTruth(String streamId, GroundTruth truth) {
        return stream(streamId).onGroundTruth(truth);
    }

    @Override
    public Optional<GovernanceDecision> onPolicyMetric(PolicyMetric metric) {
        Optional<GovernanceDecision> decision = lifecycle.onMetric(metric);
        publishGovernance();
        return decision;
    }

    @Override
    public PolicyRecord registerPolicy(String policyId, String version) {
        PolicyRecord record = lifecycle.register(policyId, version);
        publishGovernance();
        return record;
    }

    @Override
    public PolicyRecord registerLivePolicy(String policyId, String version) {
        PolicyRecord record = lifecycle.registerLive(policyId, version);
        publishGovernance();
        return record;
    }

    @Override
    public PolicyRecord startCanary(String policyId) {
        PolicyRecord record = lifecycle.startCanary(policyId);
        publishGovernance();
        return record;
    }

    @Override
    public ExecutionDecision sizeFor(String policyId, Posture posture, List<GuardEvaluation> evaluations,
                                     double baseNotional) {
        return lifecycle.sizeFor(policyId, posture, evaluations, baseNotional);
    }

    /**
     * Publish a snapshot of every stream and of governance state, e.g. before shutdown.
     */
    public void snapshotAll() {
        for (DecisionStream stream : streams.values()) {
            publisher.publish(stream.snapshot());
        }
        publishGovernance();
    }

    DecisionStream stream(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId must not be blank");
        }
        if (!STREAM_ID.matcher(streamId).matches()) {
            throw new IllegalArgumentException("streamId must match " + STREAM_ID.pattern() + ": " + streamId);
        }
        return streams.computeIfAbsent(streamId, this::openStream);
    }

    private DecisionStream openStream(String streamId) {
        DecisionStream stream = new DecisionStream(streamId, config, aggregator, gate, metrics, publisher, nanoClock);
        Optional<StreamSnapshot> snapshot = store.loadStream(streamId);
        if (snapshot.isPresent()) {
            try {
                stream.restore(snapshot.get());
            } catch (IllegalArgumentException e) {
                log.warn("[RiskEngine] Snapshot for {} rejected, starting fresh: {}", streamId, e.getMessage());
            }
        } else {
            log.info("[RiskEngine] Opened new stream {}", streamId);
        }
        return stream;
    }

    private void publishGovernance() {
        publisher.publish(new GovernanceSnapshot(GovernanceSnapshot.SCHEMA, GovernanceSnapshot.CURRENT_VERSION,
            clock.instant(), ledger.snapshot(), lifecycle.snapshot()));
    }

    public Collection<DecisionStream> streams() {
        return List.copyOf(streams.values());
    }

    public AlphaSpendingLedger ledger() {
        return ledger;
    }

    public PolicyLifecycleManager lifecycle() {
        return lifecycle;
    }
}
