package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.GuardThreshold;

import java.util.EnumMap;
import java.util.Map;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requireNonNull;
import static in.riskgov.config.ConfigChecks.requireUnit;

/**
 * Guard thresholds and state machine dwell settings.
 *
 * @param blockRecoveryCycles clean cycles before BLOCK -> PASS. With {@code fastRecoveryEnabled}
 *                            this clean window supersedes {@code blockCooldownCycles}: a clean BLOCK
 *                            stays at zero exposure until the window completes, and only a BLOCK that
 *                            is still soft-breaching steps down to DERISK after the cooldown.
 */
public record AcceptanceConfig(
    @JsonProperty("thresholds")
    Map<GuardKind, GuardThreshold> thresholds,

    @JsonProperty("dwellMinDerisk")
    int dwellMinDerisk,             // soft-breach cycles before PASS -> DERISK

    @JsonProperty("dwellMinRecovery")
    int dwellMinRecovery,           // clean cycles before DERISK -> PASS

    @JsonProperty("blockCooldownCycles")
    int blockCooldownCycles,        // minimum BLOCK dwell before BLOCK -> DERISK

    @JsonProperty("blockRecoveryCycles")
    int blockRecoveryCycles,        // clean cycles before BLOCK -> PASS

    @JsonProperty("fastRecoveryEnabled")
    boolean fastRecoveryEnabled,

    @JsonProperty("kappaPlusConfidenceFloor")
    double kappaPlusConfidenceFloor, // PASS -> DERISK when 1 - kappa_plus drops below this

    @JsonProperty("latencyWindow")
    int latencyWindow,

    @JsonProperty("surprisalWindow")
    int surprisalWindow,

    @JsonProperty("huberDelta")
    double huberDelta,

    @JsonProperty("relativeWidthFloor")
    double relativeWidthFloor,      // denominator floor for width / |point|

    @JsonProperty("winsorLower")
    double winsorLower,

    @JsonProperty("winsorUpper")
    double winsorUpper
) {
    public AcceptanceConfig {
        thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
    }

    public static AcceptanceConfig defaults() {
        Map<GuardKind, GuardThreshold> thresholds = new EnumMap<>(GuardKind.class);
        thresholds.put(GuardKind.COVERAGE_EMA, GuardThreshold.of(0.85, 0.75));
        thresholds.put(GuardKind.COVERAGE_MISS_STREAK, GuardThreshold.of(5, 12));
        thresholds.put(GuardKind.LATENCY_P95, GuardThreshold.of(100.0, 150.0));
        thresholds.put(GuardKind.SURPRISAL_P95, GuardThreshold.of(2.4, 3.2));
        thresholds.put(GuardKind.RELATIVE_INTERVAL_WIDTH, GuardThreshold.of(0.02, 0.05));
        thresholds.put(GuardKind.KAPPA, GuardThreshold.of(0.6, 0.85));
        thresholds.put(GuardKind.KAPPA_PLUS, GuardThreshold.of(0.6, 0.85));
        return new AcceptanceConfig(
            thresholds,
            3, 10, 5, 30, true,
            0.2,
            50, 100,
            1.345, 1.0,
            0.01, 0.99
        );
    }

    public GuardThreshold threshold(GuardKind guard) {
        return thresholds.get(guard);
    }

    public AcceptanceConfig withThreshold(GuardKind guard, GuardThreshold threshold) {
        Map<GuardKind, GuardThreshold> updated = new EnumMap<>(GuardKind.class);
        updated.putAll(thresholds);
        updated.put(guard, threshold);
        return new AcceptanceConfig(updated, dwellMinDerisk, dwellMinRecovery, blockCooldownCycles,
            blockRecoveryCycles, fastRecoveryEnabled, kappaPlusConfidenceFloor, latencyWindow,
            surprisalWindow, huberDelta, relativeWidthFloor, winsorLower, winsorUpper);
    }

    public void validate() {
        for (GuardKind guard : GuardKind.values()) {
            String key = "acceptance.thresholds." + guard.name();
            GuardThreshold threshold = thresholds.get(guard);
            requireNonNull(threshold, key);
            require(threshold.isOrderedFor(guard), key,
                "soft limit must be at least as strict as the hard limit: " + threshold);
        }
        require(dwellMinDerisk >= 1, "acceptance.dwellMinDerisk", "must be at least 1");
        require(dwellMinRecovery >= 1, "acceptance.dwellMinRecovery", "must be at least 1");
        require(blockCooldownCycles >= 1, "acceptance.blockCooldownCycles", "must be at least 1");
        require(blockRecoveryCycles > dwellMinRecovery, "acceptance.blockRecoveryCycles",
            "must be greater than dwellMinRecovery (" + dwellMinRecovery + ")");
        requireUnit(kappaPlusConfidenceFloor, "acceptance.kappaPlusConfidenceFloor");
        require(latencyWindow >= 1, "acceptance.latencyWindow", "must be at least 1");
        require(surprisalWindow >= 1, "acceptance.surprisalWindow", "must be at least 1");
        require(huberDelta > 0.0, "acceptance.huberDelta", "must be positive");
        require(relativeWidthFloor > 0.0, "acceptance.relativeWidthFloor", "must be positive");
        require(winsorLower >= 0.0 && winsorLower < winsorUpper && winsorUpper <= 1.0,
            "acceptance.winsor", "must satisfy 0 <= lower < upper <= 1");
    }
}
