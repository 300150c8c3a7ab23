package in.riskgov.service.governance;

import in.riskgov.config.LedgerConfig;
import in.riskgov.config.LifecycleConfig;
import in.riskgov.config.SequentialTestConfig;
import in.riskgov.domain.acceptance.GuardEvaluation;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.common.InvalidInputException;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.execution.ExecutionDecision;
import in.riskgov.domain.governance.GovernanceDecision;
import in.riskgov.domain.governance.LifecycleEvent;
import in.riskgov.domain.governance.LifecycleStatus;
import in.riskgov.domain.governance.PolicyMetric;
import in.riskgov.domain.governance.PolicyRecord;
import in.riskgov.domain.governance.RollingMetrics;
import in.riskgov.domain.governance.SequentialDecision;
import in.riskgov.domain.snapshot.LifecycleState;
import in.riskgov.domain.snapshot.SequentialTesterState;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import in.riskgov.service.execution.ExecutionRiskGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Promotes policy variants CANDIDATE -> CANARY -> SHADOW -> LIVE.
 *
 * CANARY and SHADOW each run a dedicated sequential test on the difference between
 * the candidate's metric and the mean metric of the current LIVE policy. ACCEPT_H1
 * promotes one stage; ACCEPT_H0 fails the candidate. A promoted LIVE policy
 * deprecates the previous one. Records are replaced, never deleted.
 *
 * Writes are serialised on this instance; readers see an immutable map published
 * through a volatile field.
 */
public final class PolicyLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(PolicyLifecycleManager.class);

    private final LifecycleConfig config;
    private final SequentialTestConfig testConfig;
    private final LedgerConfig ledgerConfig;
    private final AlphaSpendingLedger ledger;
    private final AlphaSpendingPolicy spendingPolicy;
    private final ExecutionRiskGate gate;
    private final Clock clock;
    private final RiskMetrics metrics;

    private volatile Map<String, PolicyRecord> records = Map.of();
    private final Map<String, SequentialGovernanceTester> testers = new HashMap<>();
    private final Deque<LifecycleEvent> audit = new ArrayDeque<>();

    public PolicyLifecycleManager(LifecycleConfig config, SequentialTestConfig testConfig, LedgerConfig ledgerConfig,
                                  AlphaSpendingLedger ledger, AlphaSpendingPolicy spendingPolicy,
                                  ExecutionRiskGate gate, Clock clock, RiskMetrics metrics) {
        this.config = config;
        this.testConfig = testConfig;
        this.ledgerConfig = ledgerConfig;
        this.ledger = ledger;
        this.spendingPolicy = spendingPolicy;
        this.gate = gate;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Register a new candidate.
     *
     * @throws IllegalStateException if the id is already known
     */
    public synchronized PolicyRecord register(String policyId, String version) {
        requireUnknown(policyId);
        Instant now = clock.instant();
        PolicyRecord record = new PolicyRecord(policyId, version, LifecycleStatus.CANDIDATE,
            RollingMetrics.empty(), now, null);
        put(record);
        event(record, null, LifecycleStatus.CANDIDATE, now, "registered");
        return record;
    }

    /**
     * Install the first LIVE policy without a promotion test.
     *
     * @throws IllegalStateException if a LIVE policy already exists or the id is known
     */
    public synchronized PolicyRecord registerLive(String policyId, String version) {
        requireUnknown(policyId);
        if (live().isPresent()) {
            throw new IllegalStateException("A LIVE policy already exists: " + live().get().policyId());
        }
        Instant now = clock.instant();
        PolicyRecord record = new PolicyRecord(policyId, version, LifecycleStatus.LIVE,
            RollingMetrics.empty(), now, now);
        put(record);
        event(record, null, LifecycleStatus.LIVE, now, "initial live policy");
        return record;
    }

    /**
     * CANDIDATE -> CANARY; starts the canary test.
     */
    public synchronized PolicyRecord startCanary(String policyId) {
        PolicyRecord record = require(policyId);
        if (record.lifecycleStatus() != LifecycleStatus.CANDIDATE) {
            throw new IllegalStateException(policyId + " cannot start canary from " + record.lifecycleStatus());
        }
        PolicyRecord canary = transition(record, LifecycleStatus.CANARY, "canary started");
        testers.put(policyId, newTester(policyId, LifecycleStatus.CANARY));
        return canary;
    }

    /**
     * Manually fail a candidate that has not reached LIVE. A running test is abandoned.
     */
    public synchronized PolicyRecord fail(String policyId, String reason) {
        PolicyRecord record = require(policyId);
        LifecycleStatus status = record.lifecycleStatus();
        if (status != LifecycleStatus.CANDIDATE && !status.isUnderTest()) {
            throw new IllegalStateException(policyId + " cannot fail from " + status);
        }
        SequentialGovernanceTester tester = testers.remove(policyId);
        if (tester != null) {
            tester.abandon(reason);
        }
        return transition(record, LifecycleStatus.FAILED, reason);
    }

    /**
     * Feed a metric. LIVE metrics update the baseline; metrics of a policy under test
     * also advance its test.
     *
     * @return the governance decision when the policy is under test
     * @throws InvalidInputException for unknown policies or non-finite metrics
     */
    public synchronized Optional<GovernanceDecision> onMetric(PolicyMetric metric) {
        PolicyRecord record = records.get(metric.policyId());
        if (record == null) {
            throw new InvalidInputException("lifecycle", "unknown policy " + metric.policyId());
        }
        if (!Double.isFinite(metric.metricValue())) {
            throw new InvalidInputException("lifecycle", "metric must be finite for " + metric.policyId());
        }
        if (record.lifecycleStatus().isTerminal()) {
            return Optional.empty();
        }

        Instant at = metric.timestamp() != null ? metric.timestamp() : clock.instant();
        record = record.withMetrics(record.rollingMetrics().update(metric.metricValue(), at));
        put(record);

        SequentialGovernanceTester tester = testers.get(record.policyId());
        if (!record.lifecycleStatus().isUnderTest() || tester == null) {
            return Optional.empty();
        }

        double x = metric.metricValue() - baselineMean();
        GovernanceDecision decision = tester.update(x, at);
        if (decision.decision() == SequentialDecision.ACCEPT_H1) {
            promote(record);
        } else if (decision.decision() == SequentialDecision.ACCEPT_H0) {
            testers.remove(record.policyId());
            transition(record, LifecycleStatus.FAILED, "ACCEPT_H0 in " + record.lifecycleStatus());
        }
        return Optional.of(decision);
    }

    private void promote(PolicyRecord record) {
        if (record.lifecycleStatus() == LifecycleStatus.CANARY) {
            transition(record, LifecycleStatus.SHADOW, "ACCEPT_H1 in CANARY");
            testers.put(record.policyId(), newTester(record.policyId(), LifecycleStatus.SHADOW));
            return;
        }
        testers.remove(record.policyId());
        Optional<PolicyRecord> previous = live();
        previous.ifPresent(old -> transition(old, LifecycleStatus.DEPRECATED,
            "superseded by " + record.policyId()));
        transition(record, LifecycleStatus.LIVE, "ACCEPT_H1 in SHADOW");
    }

    /**
     * Size an order of the given policy: the gate decision scaled by the policy's stage.
     * LIVE trades in full, CANARY at the canary fraction, every other stage not at all.
     */
    public ExecutionDecision sizeFor(String policyId, Posture posture, List<GuardEvaluation> evaluations,
                                     double baseNotional) {
        PolicyRecord record = records.get(policyId);
        if (record == null) {
            throw new InvalidInputException("lifecycle", "unknown policy " + policyId);
        }
        double stageMultiplier = stageMultiplier(record.lifecycleStatus());
        if (stageMultiplier == 0.0) {
            return ExecutionDecision.blocked(BlockReason.POLICY_STAGE);
        }
        ExecutionDecision gated = gate.decide(posture, evaluations, baseNotional);
        if (gated.isBlocked()) {
            return gated;
        }
        return new ExecutionDecision(gated.recommendedNotional() * stageMultiplier,
            gated.riskScale() * stageMultiplier, null);
    }

    private double stageMultiplier(LifecycleStatus status) {
        switch (status) {
            case LIVE:
                return 1.0;
            case CANARY:
                return config.canaryFraction();
            default:
                return 0.0;
        }
    }

    public Optional<PolicyRecord> get(String policyId) {
        return Optional.ofNullable(records.get(policyId));
    }

    public Optional<PolicyRecord> live() {
        return records.values().stream()
            .filter(r -> r.lifecycleStatus() == LifecycleStatus.LIVE)
            .findFirst();
    }

    public List<PolicyRecord> records() {
        return List.copyOf(records.values());
    }

    public synchronized List<LifecycleEvent> auditTrail() {
        return List.copyOf(audit);
    }

    public synchronized LifecycleState snapshot() {
        Map<String, SequentialTesterState> testerStates = new HashMap<>();
        testers.forEach((id, tester) -> testerStates.put(id, tester.snapshot()));
        return new LifecycleState(new ArrayList<>(records.values()), testerStates, new ArrayList<>(audit));
    }

    /**
     * Replace all records with a persisted state. Tests of CANARY and SHADOW policies resume
     * where they stopped; nothing is spent again.
     */
    public synchronized void restore(LifecycleState state) {
        if (state == null) {
            return;
        }
        Map<String, PolicyRecord> restored = new LinkedHashMap<>();
        for (PolicyRecord record : state.policies()) {
            if (record != null && record.policyId() != null && record.lifecycleStatus() != null) {
                restored.put(record.policyId(), record.rollingMetrics() == null
                    ? record.withMetrics(RollingMetrics.empty()) : record);
            }
        }
        records = Collections.unmodifiableMap(restored);
        testers.clear();
        for (PolicyRecord record : restored.values()) {
            if (record.lifecycleStatus().isUnderTest()) {
                SequentialGovernanceTester tester = newTester(record.policyId(), record.lifecycleStatus());
                tester.restore(state.testers().get(record.policyId()));
                testers.put(record.policyId(), tester);
            }
        }
        audit.clear();
        for (LifecycleEvent event : state.auditTrail()) {
            appendAudit(event);
        }
        log.info("[PolicyLifecycleManager] Restored {} policies, {} running tests", restored.size(), testers.size());
    }

    private double baselineMean() {
        return live().map(r -> r.rollingMetrics().count() > 0 ? r.rollingMetrics().mean() : 0.0).orElse(0.0);
    }

    private SequentialGovernanceTester newTester(String policyId, LifecycleStatus stage) {
        return new SequentialGovernanceTester(policyId, policyId + ":" + stage.name(), testConfig, ledger,
            spendingPolicy, ledgerConfig.expectedTests(), metrics);
    }

    private PolicyRecord transition(PolicyRecord record, LifecycleStatus to, String reason) {
        Instant now = clock.instant();
        PolicyRecord updated = record.withStatus(to, now);
        put(updated);
        event(updated, record.lifecycleStatus(), to, now, reason);
        return updated;
    }

    private void event(PolicyRecord record, LifecycleStatus from, LifecycleStatus to, Instant at, String reason) {
        appendAudit(new LifecycleEvent(record.policyId(), record.version(), from, to, at, reason));
        metrics.recordLifecycleTransition(to);
        log.info("[PolicyLifecycleManager] {} v{}: {} -> {} ({})", record.policyId(), record.version(), from, to, reason);
    }

    private void appendAudit(LifecycleEvent event) {
        audit.addLast(event);
        while (audit.size() > config.auditCapacity()) {
            audit.removeFirst();
        }
    }

    private void put(PolicyRecord record) {
        Map<String, PolicyRecord> next = new LinkedHashMap<>(records);
        next.put(record.policyId(), record);
        records = Collections.unmodifiableMap(next);
    }

    private PolicyRecord require(String policyId) {
        PolicyRecord record = records.get(policyId);
        if (record == null) {
            throw new IllegalStateException("Unknown policy " + policyId);
        }
        return record;
    }

    private void requireUnknown(String policyId) {
        if (policyId == null || policyId.isBlank()) {
            throw new IllegalArgumentException("policyId must not be blank");
        }
        if (records.containsKey(policyId)) {
            throw new IllegalStateException("Policy already registered: " + policyId);
        }
    }
}
