package in.riskgov.service.acceptance;

import in.riskgov.config.AcceptanceConfig;
import in.riskgov.domain.acceptance.GuardEvaluation;
import in.riskgov.domain.acceptance.GuardKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Checks guard values against configured thresholds, always in declaration order
 * and always for every guard. Missing values evaluate as NaN, which never breaches.
 */
public final class GuardEvaluator {

    private final AcceptanceConfig config;

    public GuardEvaluator(AcceptanceConfig config) {
        this.config = config;
    }

    public List<GuardEvaluation> evaluate(Map<GuardKind, Double> values) {
        List<GuardEvaluation> evaluations = new ArrayList<>(GuardKind.values().length);
        for (GuardKind guard : GuardKind.values()) {
            Double value = values.get(guard);
            evaluations.add(GuardEvaluation.evaluate(guard, value == null ? Double.NaN : value,
                config.threshold(guard)));
        }
        return Collections.unmodifiableList(evaluations);
    }
}
