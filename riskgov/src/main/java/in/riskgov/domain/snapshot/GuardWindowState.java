package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Rolling latency and surprisal samples, oldest first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GuardWindowState(double[] latencies, double[] surprisals) {
}
