package in.riskgov.service.governance;

import in.riskgov.config.LedgerConfig;
import in.riskgov.config.SequentialTestConfig;
import in.riskgov.domain.common.InvalidInputException;
import in.riskgov.domain.governance.AlphaLedgerEntry;
import in.riskgov.domain.governance.GovernanceDecision;
import in.riskgov.domain.governance.LedgerEventType;
import in.riskgov.domain.governance.LikelihoodKind;
import in.riskgov.domain.governance.SequentialDecision;
import in.riskgov.infrastructure.metrics.NoOpRiskMetrics;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("Sequential governance test")
class SequentialGovernanceTesterTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

    private AlphaSpendingLedger ledger;
    private SequentialGovernanceTester tester;
    private int seq;

    @BeforeEach
    void setUp() {
        ledger = new AlphaSpendingLedger(LedgerConfig.defaults(), CLOCK, NoOpRiskMetrics.INSTANCE);
        tester = tester(SequentialTestConfig.defaults(), new UniformSpendingPolicy(), NoOpRiskMetrics.INSTANCE);
        seq = 0;
    }

    private SequentialGovernanceTester tester(SequentialTestConfig config, AlphaSpendingPolicy policy,
                                              RiskMetrics metrics) {
        return new SequentialGovernanceTester("policy-a", "policy-a:CANARY", config, ledger, policy, 20, metrics);
    }

    private GovernanceDecision feed(SequentialGovernanceTester target, double x) {
        return target.update(x, T0.plusSeconds(seq++));
    }

    private GovernanceDecision feedUntilTerminal(SequentialGovernanceTester target, double x, int limit) {
        for (int i = 0; i < limit; i++) {
            GovernanceDecision decision = feed(target, x);
            if (decision.decision().isTerminal()) {
                return decision;
            }
        }
        return fail("no terminal decision within " + limit + " samples");
    }

    @Test
    @DisplayName("Arming allocates alpha and sets Wald thresholds")
    void armingAllocatesAlpha() {
        GovernanceDecision first = feed(tester, 0.3);

        assertEquals(SequentialDecision.CONTINUE, first.decision());
        assertEquals("policy-a:CANARY#1", first.testId());
        assertEquals(0.0025, first.alphaSpent(), 1e-15);
        assertEquals(0.0025, ledger.cumulativeAlpha(), 1e-15);
        assertEquals(Math.log(0.8 / 0.0025), tester.upperThreshold(), 1e-12);
        assertEquals(Math.log(0.2 / 0.9975), tester.lowerThreshold(), 1e-12);
    }

    @Test
    @DisplayName("A sustained effect is accepted once the LLR crosses the upper bound")
    void acceptsH1() {
        for (int i = 1; i < 16; i++) {
            assertEquals(SequentialDecision.CONTINUE, feed(tester, 1.0).decision(), "sample " + i);
        }
        GovernanceDecision decision = feed(tester, 1.0);

        assertEquals(SequentialDecision.ACCEPT_H1, decision.decision());
        assertEquals(16, decision.nSamples());
        assertEquals(6.0, decision.llr(), 1e-9);
        assertEquals("policy-a", decision.policyId());
        assertFalse(tester.isArmed());

        List<AlphaLedgerEntry> entries = ledger.entries();
        assertEquals(LedgerEventType.ACCEPT_H1, entries.get(entries.size() - 1).eventType());
        assertEquals(0.0025, ledger.cumulativeAlpha(), 1e-15, "outcome entries are free");
    }

    @Test
    @DisplayName("No effect is accepted as H0 at the lower bound")
    void acceptsH0() {
        GovernanceDecision decision = feedUntilTerminal(tester, 0.0, 50);

        assertEquals(SequentialDecision.ACCEPT_H0, decision.decision());
        assertEquals(13, decision.nSamples());
    }

    @Test
    @DisplayName("No decision before the minimum sample count")
    void minimumSamples() {
        GovernanceDecision decision = feedUntilTerminal(tester, 5.0, 50);
        assertEquals(SequentialDecision.ACCEPT_H1, decision.decision());
        assertEquals(10, decision.nSamples());
    }

    @Test
    @DisplayName("A truncated test accepts H0 at the sample cap")
    void truncation() {
        SequentialTestConfig capped = new SequentialTestConfig(0.2, 0.0, 0.5, 1.0, LikelihoodKind.GAUSSIAN, 10, 12);
        tester = tester(capped, new UniformSpendingPolicy(), NoOpRiskMetrics.INSTANCE);

        GovernanceDecision decision = feedUntilTerminal(tester, 0.25, 50);

        assertEquals(SequentialDecision.ACCEPT_H0, decision.decision());
        assertEquals(12, decision.nSamples());
    }

    @Test
    @DisplayName("Unknown variance uses the running sample variance")
    void generalisedLikelihood() {
        SequentialTestConfig glr = new SequentialTestConfig(0.2, 0.0, 0.5, 1.0, LikelihoodKind.GLR, 10, 0);
        tester = tester(glr, new UniformSpendingPolicy(), NoOpRiskMetrics.INSTANCE);

        GovernanceDecision decision = null;
        for (int i = 0; i < 10; i++) {
            decision = feed(tester, i % 2 == 0 ? 0.9 : 1.1);
        }

        // mean 1.0, sample variance 0.1/9
        assertEquals(SequentialDecision.ACCEPT_H1, decision.decision());
        assertEquals(337.5, decision.llr(), 1e-6);
    }

    @Test
    @DisplayName("The next sample after a decision arms and pays for a new test")
    void nextTestAfterDecision() {
        feedUntilTerminal(tester, 1.0, 50);

        GovernanceDecision next = feed(tester, 1.0);

        assertEquals("policy-a:CANARY#2", next.testId());
        assertEquals(2, ledger.allocationCount());
        assertEquals(0.005, ledger.cumulativeAlpha(), 1e-15);
        assertEquals(1, next.nSamples());
    }

    @Test
    @DisplayName("A refused allowance leaves the test in CONTINUE for good")
    void budgetDenial() {
        RiskMetrics metrics = mock(RiskMetrics.class);
        ledger.recordSpend("earlier#1", 0.04, LedgerEventType.ALLOCATE);
        tester = tester(SequentialTestConfig.defaults(), context -> 0.03, metrics);

        for (int i = 0; i < 30; i++) {
            GovernanceDecision decision = feed(tester, 5.0);
            assertEquals(SequentialDecision.CONTINUE, decision.decision());
            assertEquals(0.0, decision.alphaSpent(), 0.0);
            assertNull(decision.testId());
        }

        assertTrue(tester.isBudgetDenied());
        assertEquals(0.04, ledger.cumulativeAlpha(), 1e-15);
        verify(metrics).recordAlphaDenied();
    }

    @Test
    @DisplayName("An allowance outside (0, 1) is refused")
    void invalidAllowance() {
        tester = tester(SequentialTestConfig.defaults(), context -> 0.0, NoOpRiskMetrics.INSTANCE);
        feed(tester, 1.0);
        assertTrue(tester.isBudgetDenied());
        assertEquals(0, ledger.allocationCount());
    }

    @Test
    @DisplayName("Non-finite samples are rejected")
    void rejectsNonFinite() {
        assertThrows(InvalidInputException.class, () -> tester.update(Double.NaN, T0));
        assertThrows(InvalidInputException.class, () -> tester.update(Double.NEGATIVE_INFINITY, T0));
        assertEquals(0, ledger.allocationCount(), "rejected input must not arm a test");
    }

    @Test
    @DisplayName("Abandoning a running test records the outcome")
    void abandon() {
        feed(tester, 1.0);
        feed(tester, 1.0);

        tester.abandon("candidate withdrawn");

        assertFalse(tester.isArmed());
        List<AlphaLedgerEntry> entries = ledger.entries();
        AlphaLedgerEntry last = entries.get(entries.size() - 1);
        assertEquals(LedgerEventType.ABANDON, last.eventType());
        assertEquals("policy-a:CANARY#1", last.testId());
    }

    @Test
    @DisplayName("A restored test resumes without spending again")
    void restoreResumes() {
        for (int i = 0; i < 8; i++) {
            feed(tester, 1.0);
        }

        SequentialGovernanceTester resumed = tester(SequentialTestConfig.defaults(), new UniformSpendingPolicy(),
            NoOpRiskMetrics.INSTANCE);
        resumed.restore(tester.snapshot());

        assertTrue(resumed.isArmed());
        assertEquals(tester.upperThreshold(), resumed.upperThreshold(), 0.0);
        GovernanceDecision decision = feedUntilTerminal(resumed, 1.0, 50);
        assertEquals(16, decision.nSamples());
        assertEquals(1, ledger.allocationCount());
    }

    @Test
    @DisplayName("A restored test decides even when the budget is exhausted")
    void restoredTestDecidesAtExhaustedBudget() {
        for (int i = 0; i < 8; i++) {
            feed(tester, 1.0);
        }
        ledger.recordSpend("policy-b:CANARY#1", 0.0475, LedgerEventType.ALLOCATE);
        AlphaSpendingLedger restoredLedger = new AlphaSpendingLedger(LedgerConfig.defaults(), CLOCK,
            NoOpRiskMetrics.INSTANCE);
        restoredLedger.restore(ledger.snapshot());
        SequentialGovernanceTester resumed = new SequentialGovernanceTester("policy-a", "policy-a:CANARY",
            SequentialTestConfig.defaults(), restoredLedger, new UniformSpendingPolicy(), 20, NoOpRiskMetrics.INSTANCE);
        resumed.restore(tester.snapshot());

        GovernanceDecision decision = feedUntilTerminal(resumed, 1.0, 50);

        assertEquals(SequentialDecision.ACCEPT_H1, decision.decision());
        assertEquals(0.05, restoredLedger.cumulativeAlpha(), 1e-15);
        List<AlphaLedgerEntry> entries = restoredLedger.entries();
        assertEquals(LedgerEventType.ACCEPT_H1, entries.get(entries.size() - 1).eventType());
    }
}
