package in.riskgov.domain.acceptance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Map;

/**
 * Persistable state of the acceptance state machine of one stream.
 *
 * @param dwellCounter        cycles spent in the current posture
 * @param softBreachStreak    consecutive cycles with at least one soft breach
 * @param cleanStreak         consecutive cycles with no breach at all
 * @param violationsByGuard   cumulative soft-or-hard breach count per guard
 * @param transitionCounts    cumulative count per transition
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AcceptanceState(
    Posture posture,
    int dwellCounter,
    Instant lastTransitionTs,
    Map<GuardKind, Long> violationsByGuard,
    int softBreachStreak,
    int cleanStreak,
    Map<PostureTransition, Long> transitionCounts,
    long cycles
) {
    public AcceptanceState {
        violationsByGuard = violationsByGuard == null ? Map.of() : Map.copyOf(violationsByGuard);
        transitionCounts = transitionCounts == null ? Map.of() : Map.copyOf(transitionCounts);
    }

    public static AcceptanceState initial() {
        return new AcceptanceState(Posture.PASS, 0, null, Map.of(), 0, 0, Map.of(), 0);
    }
}
