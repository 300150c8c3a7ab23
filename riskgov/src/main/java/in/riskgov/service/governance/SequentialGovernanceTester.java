package in.riskgov.service.governance;

import in.riskgov.config.SequentialTestConfig;
import in.riskgov.domain.common.BudgetExceededException;
import in.riskgov.domain.common.InvalidInputException;
import in.riskgov.domain.governance.GovernanceDecision;
import in.riskgov.domain.governance.LedgerEventType;
import in.riskgov.domain.governance.RollingMetrics;
import in.riskgov.domain.governance.SequentialDecision;
import in.riskgov.domain.governance.SequentialTestState;
import in.riskgov.domain.snapshot.SequentialTesterState;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Wald sequential probability ratio test with alpha drawn from the global ledger.
 *
 * A test is armed on its first sample: the spending policy names an allowance and
 * the ledger must accept it. A refused allowance leaves the tester answering
 * CONTINUE for good. A terminal decision is written to the ledger as an outcome
 * entry and resets the tester, so the next sample arms, and pays for, a new test.
 *
 * Not thread-safe; callers serialise access.
 */
public final class SequentialGovernanceTester {
    private static final Logger log = LoggerFactory.getLogger(SequentialGovernanceTester.class);

    private final String subjectId;
    private final String testerId;
    private final SequentialTestConfig config;
    private final AlphaSpendingLedger ledger;
    private final AlphaSpendingPolicy policy;
    private final int expectedTests;
    private final LikelihoodModel likelihood;
    private final RiskMetrics metrics;

    private double llr;
    private RollingMetrics samples = RollingMetrics.empty();
    private double alphaTest;
    private double upper;
    private double lower;
    private boolean armed;
    private boolean budgetDenied;
    private int testIndex;

    public SequentialGovernanceTester(String subjectId, String testerId, SequentialTestConfig config,
                                      AlphaSpendingLedger ledger, AlphaSpendingPolicy policy,
                                      int expectedTests, RiskMetrics metrics) {
        this.subjectId = subjectId;
        this.testerId = testerId;
        this.config = config;
        this.ledger = ledger;
        this.policy = policy;
        this.expectedTests = expectedTests;
        this.likelihood = LikelihoodModel.from(config);
        this.metrics = metrics;
    }

    /**
     * Feed one sample.
     *
     * @throws InvalidInputException if {@code x} is not finite
     */
    public GovernanceDecision update(double x, Instant timestamp) {
        if (!Double.isFinite(x)) {
            throw new InvalidInputException(testerId, "governance sample must be finite, got " + x);
        }
        if (!armed && !budgetDenied) {
            arm();
        }
        if (budgetDenied) {
            return decision(SequentialDecision.CONTINUE, timestamp);
        }

        samples = samples.update(x, timestamp);
        llr = likelihood.next(llr, x, samples);

        SequentialDecision outcome = decide();
        if (!outcome.isTerminal()) {
            return decision(outcome, timestamp);
        }

        GovernanceDecision result = decision(outcome, timestamp);
        ledger.recordSpend(currentTestId(), 0.0,
            outcome == SequentialDecision.ACCEPT_H1 ? LedgerEventType.ACCEPT_H1 : LedgerEventType.ACCEPT_H0);
        metrics.recordGovernanceDecision(outcome);
        log.info("[SequentialGovernanceTester:{}] {} after {} samples, llr={}, alpha={}",
            testerId, outcome, samples.count(), llr, alphaTest);
        resetTest();
        return result;
    }

    private SequentialDecision decide() {
        long n = samples.count();
        if (n < config.minSamples()) {
            return SequentialDecision.CONTINUE;
        }
        if (llr >= upper) {
            return SequentialDecision.ACCEPT_H1;
        }
        if (llr <= lower) {
            return SequentialDecision.ACCEPT_H0;
        }
        if (config.maxSamples() > 0 && n >= config.maxSamples()) {
            return SequentialDecision.ACCEPT_H0;
        }
        return SequentialDecision.CONTINUE;
    }

    private void arm() {
        int index = testIndex + 1;
        double allowance = policy.allowance(
            new SpendingContext(ledger.totalBudget(), expectedTests, index, ledger.allocationCount()));
        String testId = testerId + "#" + index;

        if (!(allowance > 0.0 && allowance < 1.0) || !ledger.canSpend(allowance)) {
            deny(testId, allowance);
            return;
        }
        try {
            ledger.recordSpend(testId, allowance, LedgerEventType.ALLOCATE);
        } catch (BudgetExceededException e) {
            // another tester took the remaining budget between the check and the spend
            deny(testId, allowance);
            return;
        }
        testIndex = index;
        alphaTest = allowance;
        thresholds();
        armed = true;
    }

    private void thresholds() {
        upper = Math.log((1.0 - config.beta()) / alphaTest);
        lower = Math.log(config.beta() / (1.0 - alphaTest));
    }

    private void deny(String testId, double allowance) {
        budgetDenied = true;
        metrics.recordAlphaDenied();
        log.warn("[SequentialGovernanceTester:{}] Alpha budget refused {} for {} (remaining {}); test stays CONTINUE",
            testerId, allowance, testId, ledger.remaining());
    }

    /**
     * Drop a running test and record the abandonment. A budget refusal is not cleared.
     */
    public void abandon(String reason) {
        if (!armed) {
            return;
        }
        ledger.recordSpend(currentTestId(), 0.0, LedgerEventType.ABANDON);
        log.info("[SequentialGovernanceTester:{}] Abandoned {}: {}", testerId, currentTestId(), reason);
        resetTest();
    }

    private void resetTest() {
        llr = 0.0;
        samples = RollingMetrics.empty();
        alphaTest = 0.0;
        armed = false;
    }

    private GovernanceDecision decision(SequentialDecision outcome, Instant timestamp) {
        return new GovernanceDecision(subjectId, armed ? currentTestId() : null, outcome, llr,
            (int) samples.count(), alphaTest, timestamp);
    }

    private String currentTestId() {
        return testerId + "#" + testIndex;
    }

    public SequentialTestState state() {
        return new SequentialTestState(llr, (int) samples.count(), SequentialDecision.CONTINUE);
    }

    public boolean isBudgetDenied() {
        return budgetDenied;
    }

    public boolean isArmed() {
        return armed;
    }

    public double alphaTest() {
        return alphaTest;
    }

    public double upperThreshold() {
        return upper;
    }

    public double lowerThreshold() {
        return lower;
    }

    public String testerId() {
        return testerId;
    }

    public SequentialTesterState snapshot() {
        return new SequentialTesterState(llr, samples, alphaTest, armed, budgetDenied, testIndex);
    }

    /**
     * Resume an armed test or a budget refusal. Nothing is spent on restore.
     */
    public void restore(SequentialTesterState state) {
        resetTest();
        budgetDenied = false;
        testIndex = 0;
        if (state == null) {
            return;
        }
        testIndex = Math.max(0, state.testIndex());
        budgetDenied = state.budgetDenied();
        if (state.armed() && state.alphaTest() > 0.0 && state.alphaTest() < 1.0) {
            armed = true;
            alphaTest = state.alphaTest();
            llr = Double.isFinite(state.logLikelihoodRatio()) ? state.logLikelihoodRatio() : 0.0;
            samples = state.samples() == null ? RollingMetrics.empty() : state.samples();
            thresholds();
        }
    }
}
