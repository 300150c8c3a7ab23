package in.riskgov.service.acceptance;

import in.riskgov.config.AcceptanceConfig;
import in.riskgov.domain.acceptance.AcceptanceStep;
import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.acceptance.PostureTransition;
import in.riskgov.infrastructure.metrics.NoOpRiskMetrics;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("Acceptance state machine")
class AcceptanceOrchestratorTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:15:00Z");

    private static final Map<GuardKind, Double> CLEAN = Map.of();
    private static final Map<GuardKind, Double> SOFT = Map.of(GuardKind.KAPPA, 0.7);
    private static final Map<GuardKind, Double> HARD = Map.of(GuardKind.KAPPA, 0.9);

    private AcceptanceOrchestrator orchestrator;
    private int cycle;

    @BeforeEach
    void setUp() {
        orchestrator = new AcceptanceOrchestrator("s1", AcceptanceConfig.defaults(), NoOpRiskMetrics.INSTANCE);
        cycle = 0;
    }

    private AcceptanceStep step(Map<GuardKind, Double> values) {
        return orchestrator.evaluate(T0.plusSeconds(cycle++), values);
    }

    private void steps(int n, Map<GuardKind, Double> values) {
        for (int i = 0; i < n; i++) {
            step(values);
        }
    }

    private static AcceptanceConfig withFastRecovery(boolean enabled) {
        AcceptanceConfig d = AcceptanceConfig.defaults();
        return new AcceptanceConfig(d.thresholds(), d.dwellMinDerisk(), d.dwellMinRecovery(),
            d.blockCooldownCycles(), d.blockRecoveryCycles(), enabled, d.kappaPlusConfidenceFloor(),
            d.latencyWindow(), d.surprisalWindow(), d.huberDelta(), d.relativeWidthFloor(),
            d.winsorLower(), d.winsorUpper());
    }

    private void driveToBlock() {
        step(HARD);
        step(HARD);
        assertEquals(Posture.BLOCK, orchestrator.posture());
    }

    @Test
    @DisplayName("Starts in PASS and stays there while clean")
    void cleanStaysPass() {
        steps(50, CLEAN);
        assertEquals(Posture.PASS, orchestrator.posture());
        assertEquals(0, orchestrator.transitionCount(PostureTransition.PASS_TO_DERISK));
    }

    @Test
    @DisplayName("Soft breaches need the dwell before PASS -> DERISK")
    void softBreachDwell() {
        assertNull(step(SOFT).transition());
        assertNull(step(SOFT).transition());
        AcceptanceStep third = step(SOFT);

        assertEquals(PostureTransition.PASS_TO_DERISK, third.transition());
        assertEquals(Posture.DERISK, third.posture());
    }

    @Test
    @DisplayName("An interrupted soft streak starts over")
    void interruptedSoftStreak() {
        step(SOFT);
        step(SOFT);
        step(CLEAN);
        step(SOFT);
        step(SOFT);
        assertEquals(Posture.PASS, orchestrator.posture());
        step(SOFT);
        assertEquals(Posture.DERISK, orchestrator.posture());
    }

    @Test
    @DisplayName("A hard breach reaches BLOCK one cycle after leaving PASS")
    void hardBreachFastDowngrade() {
        AcceptanceStep first = step(HARD);
        assertEquals(Posture.DERISK, first.posture(), "one transition per cycle");
        assertTrue(first.anyHardBreach());

        AcceptanceStep second = step(HARD);
        assertEquals(PostureTransition.DERISK_TO_BLOCK, second.transition());
        assertEquals(Posture.BLOCK, second.posture());
    }

    @Test
    @DisplayName("Low kappa_plus confidence leaves PASS immediately")
    void lowConfidenceDerisks() {
        AcceptanceStep result = step(Map.of(GuardKind.KAPPA_PLUS, 0.82));
        assertEquals(Posture.DERISK, result.posture());
    }

    @Test
    @DisplayName("DERISK -> PASS after the recovery dwell of clean cycles")
    void deriskRecovery() {
        step(HARD);
        steps(9, CLEAN);
        assertEquals(Posture.DERISK, orchestrator.posture());
        AcceptanceStep tenth = step(CLEAN);
        assertEquals(PostureTransition.DERISK_TO_PASS, tenth.transition());
    }

    @Test
    @DisplayName("Soft breaches hold DERISK without escalating")
    void softHoldsDerisk() {
        step(HARD);
        steps(40, SOFT);
        assertEquals(Posture.DERISK, orchestrator.posture());
    }

    @Test
    @DisplayName("Hard breaches keep BLOCK")
    void hardKeepsBlock() {
        driveToBlock();
        steps(40, HARD);
        assertEquals(Posture.BLOCK, orchestrator.posture());
    }

    @Test
    @DisplayName("Clean BLOCK returns straight to PASS after the extended window")
    void directRecoveryFromBlock() {
        driveToBlock();
        steps(29, CLEAN);
        assertEquals(Posture.BLOCK, orchestrator.posture());

        AcceptanceStep last = step(CLEAN);
        assertEquals(PostureTransition.BLOCK_TO_PASS, last.transition());
        assertEquals(0, orchestrator.transitionCount(PostureTransition.BLOCK_TO_DERISK));
    }

    @Test
    @DisplayName("Soft-breaching BLOCK steps down to DERISK after the cooldown")
    void softBlockStepsDown() {
        driveToBlock();
        steps(4, SOFT);
        assertEquals(Posture.BLOCK, orchestrator.posture());
        AcceptanceStep fifth = step(SOFT);
        assertEquals(PostureTransition.BLOCK_TO_DERISK, fifth.transition());
    }

    @Test
    @DisplayName("Without the direct path a clean BLOCK recovers through DERISK")
    void sequentialRecoveryWhenDirectPathDisabled() {
        orchestrator = new AcceptanceOrchestrator("s1", withFastRecovery(false), NoOpRiskMetrics.INSTANCE);
        driveToBlock();

        steps(4, CLEAN);
        assertEquals(Posture.BLOCK, orchestrator.posture());
        assertEquals(PostureTransition.BLOCK_TO_DERISK, step(CLEAN).transition());

        steps(9, CLEAN);
        assertEquals(Posture.DERISK, orchestrator.posture());
        assertEquals(PostureTransition.DERISK_TO_PASS, step(CLEAN).transition());
        assertEquals(0, orchestrator.transitionCount(PostureTransition.BLOCK_TO_PASS));
    }

    @Test
    @DisplayName("Violations and transitions are counted and reported")
    void countsAndMetrics() {
        RiskMetrics metrics = mock(RiskMetrics.class);
        orchestrator = new AcceptanceOrchestrator("s1", AcceptanceConfig.defaults(), metrics);

        step(HARD);
        step(HARD);

        assertEquals(2, orchestrator.violationCount(GuardKind.KAPPA));
        assertEquals(0, orchestrator.violationCount(GuardKind.LATENCY_P95));
        verify(metrics).recordTransition(PostureTransition.PASS_TO_DERISK);
        verify(metrics).recordTransition(PostureTransition.DERISK_TO_BLOCK);
        verify(metrics, times(2)).recordGuardViolation(GuardKind.KAPPA, true);
        verify(metrics).recordDecision(Posture.DERISK);
        verify(metrics).recordDecision(Posture.BLOCK);
    }

    @Test
    @DisplayName("A restored machine keeps its dwell and streaks")
    void restoreResumes() {
        driveToBlock();
        steps(20, CLEAN);

        AcceptanceOrchestrator resumed = new AcceptanceOrchestrator("s1", AcceptanceConfig.defaults(),
            NoOpRiskMetrics.INSTANCE);
        resumed.restore(orchestrator.snapshot());

        for (int i = 0; i < 9; i++) {
            assertEquals(Posture.BLOCK, resumed.evaluate(T0.plusSeconds(1_000 + i), CLEAN).posture());
        }
        assertEquals(PostureTransition.BLOCK_TO_PASS, resumed.evaluate(T0.plusSeconds(2_000), CLEAN).transition());
        assertEquals(1, resumed.transitionCount(PostureTransition.DERISK_TO_BLOCK));
    }
}
