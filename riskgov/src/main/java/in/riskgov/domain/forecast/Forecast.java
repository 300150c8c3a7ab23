package in.riskgov.domain.forecast;

import java.time.Instant;
import java.util.List;

/**
 * One model output for a decision stream, consumed once per cycle.
 *
 * @param timestamp        strictly increasing per stream
 * @param pointForecast    model point estimate
 * @param sigmaHat         model scale estimate, must be positive
 * @param regimeTransition true while the model flags a regime change
 * @param modelConfidence  class probabilities from the model; empty when unavailable
 * @param aciEma           smoothed instability index, 0 when unknown
 * @param latencyMs        upstream latency of this cycle, NaN when unknown
 * @param baseNotional     size the execution layer would trade at full confidence
 */
public record Forecast(
    Instant timestamp,
    double pointForecast,
    double sigmaHat,
    boolean regimeTransition,
    List<Double> modelConfidence,
    double aciEma,
    double latencyMs,
    double baseNotional
) {
    public Forecast {
        modelConfidence = modelConfidence == null ? List.of() : List.copyOf(modelConfidence);
    }

    public static Forecast of(Instant timestamp, double pointForecast, double sigmaHat, double baseNotional) {
        return new Forecast(timestamp, pointForecast, sigmaHat, false, List.of(), 0.0, Double.NaN, baseNotional);
    }

    public Forecast withLatencyMs(double latency) {
        return new Forecast(timestamp, pointForecast, sigmaHat, regimeTransition, modelConfidence,
            aciEma, latency, baseNotional);
    }

    public Forecast withRegimeTransition(boolean transition) {
        return new Forecast(timestamp, pointForecast, sigmaHat, transition, modelConfidence,
            aciEma, latencyMs, baseNotional);
    }

    public Forecast withAciEma(double aci) {
        return new Forecast(timestamp, pointForecast, sigmaHat, regimeTransition, modelConfidence,
            aci, latencyMs, baseNotional);
    }

    public Forecast withModelConfidence(List<Double> probabilities) {
        return new Forecast(timestamp, pointForecast, sigmaHat, regimeTransition, probabilities,
            aciEma, latencyMs, baseNotional);
    }
}
