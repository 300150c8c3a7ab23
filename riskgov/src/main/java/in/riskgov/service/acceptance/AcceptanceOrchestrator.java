package in.riskgov.service.acceptance;

import in.riskgov.config.AcceptanceConfig;
import in.riskgov.domain.acceptance.AcceptanceState;
import in.riskgov.domain.acceptance.AcceptanceStep;
import in.riskgov.domain.acceptance.GuardEvaluation;
import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.acceptance.PostureTransition;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hysteretic PASS / DERISK / BLOCK state machine of one decision stream.
 *
 * Downgrades are fast: a hard breach leaves PASS at once and reaches BLOCK on the
 * next cycle. Upgrades are slow: they need a clean streak of the configured length.
 * At most one transition happens per cycle, and every transition resets the dwell
 * and streak counters.
 *
 * In BLOCK, once the cooldown has elapsed and nothing is hard-breached, a stream
 * that is still soft-breaching steps down to DERISK. A fully clean stream does the
 * same unless the direct path is enabled, in which case it stays blocked until
 * the extended clean window completes and then returns straight to PASS.
 *
 * Not thread-safe; a stream serialises its calls.
 */
public final class AcceptanceOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AcceptanceOrchestrator.class);

    private static final int MIN_DERISK_DWELL_BEFORE_BLOCK = 1;

    private final String streamId;
    private final AcceptanceConfig config;
    private final GuardEvaluator evaluator;
    private final RiskMetrics metrics;

    private Posture posture = Posture.PASS;
    private int dwell;
    private int softStreak;
    private int cleanStreak;
    private Instant lastTransitionTs;
    private long cycles;
    private final Map<GuardKind, Long> violations = new EnumMap<>(GuardKind.class);
    private final Map<PostureTransition, Long> transitions = new EnumMap<>(PostureTransition.class);

    public AcceptanceOrchestrator(String streamId, AcceptanceConfig config, RiskMetrics metrics) {
        this.streamId = streamId;
        this.config = config;
        this.evaluator = new GuardEvaluator(config);
        this.metrics = metrics;
    }

    /**
     * Evaluate the guard values of one cycle and advance the state machine.
     */
    public AcceptanceStep evaluate(Instant timestamp, Map<GuardKind, Double> guardValues) {
        List<GuardEvaluation> evaluations = evaluator.evaluate(guardValues);
        cycles++;
        dwell++;

        boolean anySoft = false;
        boolean anyHard = false;
        for (GuardEvaluation evaluation : evaluations) {
            if (evaluation.breachedSoft()) {
                anySoft = true;
                violations.merge(evaluation.guard(), 1L, Long::sum);
                metrics.recordGuardViolation(evaluation.guard(), evaluation.breachedHard());
            }
            anyHard |= evaluation.breachedHard();
        }
        softStreak = anySoft ? softStreak + 1 : 0;
        cleanStreak = anySoft ? 0 : cleanStreak + 1;

        PostureTransition transition = nextTransition(anySoft, anyHard, guardValues.get(GuardKind.KAPPA_PLUS));
        if (transition != null) {
            apply(transition, timestamp);
        }
        metrics.recordDecision(posture);
        return new AcceptanceStep(posture, transition, evaluations);
    }

    private PostureTransition nextTransition(boolean anySoft, boolean anyHard, Double kappaPlus) {
        switch (posture) {
            case PASS:
                if (anyHard || softStreak >= config.dwellMinDerisk() || lowConfidence(kappaPlus)) {
                    return PostureTransition.PASS_TO_DERISK;
                }
                return null;
            case DERISK:
                if (anyHard && dwell >= MIN_DERISK_DWELL_BEFORE_BLOCK) {
                    return PostureTransition.DERISK_TO_BLOCK;
                }
                if (cleanStreak >= config.dwellMinRecovery()) {
                    return PostureTransition.DERISK_TO_PASS;
                }
                return null;
            case BLOCK:
                if (config.fastRecoveryEnabled() && cleanStreak >= config.blockRecoveryCycles()) {
                    return PostureTransition.BLOCK_TO_PASS;
                }
                boolean waitForDirectPath = config.fastRecoveryEnabled() && !anySoft;
                if (!anyHard && !waitForDirectPath && dwell >= config.blockCooldownCycles()) {
                    return PostureTransition.BLOCK_TO_DERISK;
                }
                return null;
            default:
                throw new IllegalStateException("Unknown posture " + posture);
        }
    }

    private boolean lowConfidence(Double kappaPlus) {
        return kappaPlus != null && Double.isFinite(kappaPlus)
            && (1.0 - kappaPlus) < config.kappaPlusConfidenceFloor();
    }

    private void apply(PostureTransition transition, Instant timestamp) {
        log.info("[AcceptanceOrchestrator:{}] {} -> {} after {} cycles", streamId,
            transition.from(), transition.to(), dwell);
        posture = transition.to();
        dwell = 0;
        softStreak = 0;
        cleanStreak = 0;
        lastTransitionTs = timestamp;
        transitions.merge(transition, 1L, Long::sum);
        metrics.recordTransition(transition);
    }

    public Posture posture() {
        return posture;
    }

    public long transitionCount(PostureTransition transition) {
        return transitions.getOrDefault(transition, 0L);
    }

    public long violationCount(GuardKind guard) {
        return violations.getOrDefault(guard, 0L);
    }

    public AcceptanceState snapshot() {
        return new AcceptanceState(posture, dwell, lastTransitionTs, violations, softStreak, cleanStreak,
            transitions, cycles);
    }

    /**
     * Resume from a snapshot. A missing posture resumes in PASS with fresh counters.
     */
    public void restore(AcceptanceState state) {
        violations.clear();
        transitions.clear();
        if (state == null || state.posture() == null) {
            posture = Posture.PASS;
            dwell = 0;
            softStreak = 0;
            cleanStreak = 0;
            lastTransitionTs = null;
            cycles = 0;
            return;
        }
        posture = state.posture();
        dwell = Math.max(0, state.dwellCounter());
        softStreak = Math.max(0, state.softBreachStreak());
        cleanStreak = Math.max(0, state.cleanStreak());
        lastTransitionTs = state.lastTransitionTs();
        cycles = Math.max(0, state.cycles());
        violations.putAll(state.violationsByGuard());
        transitions.putAll(state.transitionCounts());
    }
}
