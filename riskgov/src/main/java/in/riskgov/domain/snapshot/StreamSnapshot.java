package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import in.riskgov.domain.acceptance.AcceptanceState;
import in.riskgov.domain.forecast.IntervalPrediction;

import java.time.Instant;
import java.util.List;

/**
 * Everything needed to resume a decision stream exactly. Fields added in later
 * versions must tolerate being absent from older files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamSnapshot(
    String schema,
    int version,
    String streamId,
    Instant savedAt,
    Instant lastForecastTs,
    CalibrationState calibration,
    AcceptanceState acceptance,
    CoverageTrackerState coverage,
    GuardWindowState guardWindows,
    List<IntervalPrediction> pending
) {
    public static final String SCHEMA = "riskgov.stream";
    public static final int CURRENT_VERSION = 1;

    public StreamSnapshot {
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    public String key() {
        return "stream-" + streamId;
    }
}
