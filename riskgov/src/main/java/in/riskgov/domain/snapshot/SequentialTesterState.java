package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import in.riskgov.domain.governance.RollingMetrics;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SequentialTesterState(
    double logLikelihoodRatio,
    RollingMetrics samples,
    double alphaTest,
    boolean armed,
    boolean budgetDenied,
    int testIndex
) {
}
