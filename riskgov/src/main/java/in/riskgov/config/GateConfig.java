package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.riskgov.domain.acceptance.Posture;

import java.util.EnumMap;
import java.util.Map;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requireNonNull;

/**
 * Execution gate sizing.
 */
public record GateConfig(
    @JsonProperty("scaleMap")
    Map<Posture, Double> scaleMap,

    @JsonProperty("minNotional")
    double minNotional,

    @JsonProperty("maxNotional")
    double maxNotional,

    @JsonProperty("hardBlockOnGuard")
    boolean hardBlockOnGuard
) {
    public GateConfig {
        scaleMap = scaleMap == null ? Map.of() : Map.copyOf(scaleMap);
    }

    public static GateConfig defaults() {
        Map<Posture, Double> scales = new EnumMap<>(Posture.class);
        scales.put(Posture.PASS, 1.0);
        scales.put(Posture.DERISK, 0.5);
        scales.put(Posture.BLOCK, 0.0);
        return new GateConfig(scales, 0.0, 1_000_000_000.0, true);
    }

    public double scaleFor(Posture posture) {
        return scaleMap.get(posture);
    }

    public void validate() {
        for (Posture posture : Posture.values()) {
            String key = "gate.scaleMap." + posture.name();
            Double scale = scaleMap.get(posture);
            requireNonNull(scale, key);
            require(scale >= 0.0 && scale <= 1.0, key, "must lie in [0, 1], got " + scale);
        }
        require(scaleMap.get(Posture.BLOCK) == 0.0, "gate.scaleMap.BLOCK", "must be 0");
        require(minNotional >= 0.0, "gate.minNotional", "must be non-negative");
        require(maxNotional >= minNotional, "gate.maxNotional", "must be at least minNotional");
    }
}
