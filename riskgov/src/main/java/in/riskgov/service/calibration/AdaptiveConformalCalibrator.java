package in.riskgov.service.calibration;

import in.riskgov.config.CalibrationConfig;
import in.riskgov.config.QuantileConfig;
import in.riskgov.domain.common.InvalidInputException;
import in.riskgov.domain.forecast.IntervalPrediction;
import in.riskgov.domain.snapshot.CalibrationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Adaptive conformal calibrator for one decision stream.
 *
 * Residual scores |y - point| / sigma feed a streaming quantile estimator. The
 * interval half-width is that quantile at 1 - alpha_target times sigma, widened by
 * an instability premium: the ratio current_alpha / alpha_target (transition flag
 * and ACI raise current_alpha) times the miss-cluster inflation factor, capped at
 * the inflation ceiling.
 *
 * alpha_target follows the adaptive conformal update
 * alpha_target += eta * (hit - (1 - alpha_base)), so persistent over-coverage
 * raises alpha and tightens intervals while under-coverage lowers it and widens them.
 *
 * Not thread-safe; a stream serialises its calls.
 */
public final class AdaptiveConformalCalibrator {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveConformalCalibrator.class);

    private final String streamId;
    private final CalibrationConfig config;
    private final QuantileEstimator scores;

    private double currentAlpha;
    private double alphaTarget;
    private double coverageEma;
    private int missStreak;
    private double inflationFactor;
    private int cooldownCounter;
    private long observations;

    public AdaptiveConformalCalibrator(String streamId, CalibrationConfig config, QuantileConfig quantileConfig) {
        this.streamId = streamId;
        this.config = config;
        this.scores = new QuantileEstimator(quantileConfig);
        this.currentAlpha = config.alphaBase();
        this.alphaTarget = config.alphaBase();
        this.coverageEma = 1.0 - config.alphaBase();
        this.inflationFactor = 1.0;
    }

    /**
     * Build the calibrated interval for a forecast.
     *
     * @throws InvalidInputException if sigma is not a positive finite number or point is not finite
     */
    public IntervalPrediction predictInterval(Instant timestamp, double point, double sigma,
                                              boolean transition, double aciEma) {
        if (!Double.isFinite(sigma) || sigma <= 0.0) {
            throw new InvalidInputException(streamId, "sigma_hat must be positive, got " + sigma);
        }
        if (!Double.isFinite(point)) {
            throw new InvalidInputException(streamId, "point forecast must be finite, got " + point);
        }
        double aci = Double.isFinite(aciEma) ? Math.max(0.0, aciEma) : 0.0;

        double alpha = clip(alphaTarget + config.transitionPremium() * (transition ? 1.0 : 0.0)
            + config.aciWeight() * aci);
        double q = scores.count() >= config.minCalibration()
            ? scores.estimate(1.0 - alphaTarget)
            : config.zRef();
        double widening = Math.min(config.inflationCeiling(), (alpha / alphaTarget) * inflationFactor);
        double margin = Math.max(0.0, q) * effectiveSigma(sigma, point) * widening;

        currentAlpha = alpha;
        return new IntervalPrediction(timestamp, point, sigma, transition, point - margin, point + margin, alpha);
    }

    /**
     * Score a realised value against the interval it was predicted with.
     *
     * @return true if the interval covered the value
     */
    public boolean onObservation(double groundTruth, IntervalPrediction prediction) {
        if (!Double.isFinite(groundTruth)) {
            throw new InvalidInputException(streamId, "ground truth must be finite, got " + groundTruth);
        }
        boolean hit = prediction.contains(groundTruth);
        double hitValue = hit ? 1.0 : 0.0;
        observations++;

        coverageEma = (1.0 - config.coverageEmaBeta()) * coverageEma + config.coverageEmaBeta() * hitValue;

        double eta = prediction.regimeTransition() ? config.etaTransition() : config.etaBase();
        double error = hitValue - (1.0 - config.alphaBase());
        alphaTarget = clip(alphaTarget + eta * error);

        missStreak = hit ? 0 : missStreak + 1;
        updateInflation(hit);

        double sigma = effectiveSigma(prediction.sigmaHat(), prediction.pointForecast());
        scores.observe(Math.abs(groundTruth - prediction.pointForecast()) / sigma);

        if (log.isDebugEnabled()) {
            log.debug("[Calibrator:{}] hit={} alphaTarget={} coverageEma={} missStreak={} inflation={}",
                streamId, hit, alphaTarget, coverageEma, missStreak, inflationFactor);
        }
        return hit;
    }

    private void updateInflation(boolean hit) {
        if (cooldownCounter > 0) {
            cooldownCounter--;
            if (cooldownCounter == 0 && inflationFactor != 1.0) {
                inflationFactor = 1.0;
                log.debug("[Calibrator:{}] Inflation cooldown ended", streamId);
            }
        }
        if (!hit && missStreak >= config.missCluster() && cooldownCounter == 0) {
            double raised = Math.min(config.inflationCeiling(), inflationFactor * (1.0 + config.inflationStep()));
            if (raised > inflationFactor) {
                log.info("[Calibrator:{}] Miss cluster of {}; inflation {} -> {}",
                    streamId, missStreak, inflationFactor, raised);
            }
            inflationFactor = raised;
            cooldownCounter = config.cooldownSteps();
        }
    }

    private double clip(double alpha) {
        return Math.max(config.alphaMin(), Math.min(config.alphaMax(), alpha));
    }

    private static double effectiveSigma(double sigma, double point) {
        return Math.max(sigma, 1e-6 * Math.max(1.0, Math.abs(point)));
    }

    public double currentAlpha() {
        return currentAlpha;
    }

    public double alphaTarget() {
        return alphaTarget;
    }

    public double coverageEma() {
        return coverageEma;
    }

    public int missStreak() {
        return missStreak;
    }

    public double inflationFactor() {
        return inflationFactor;
    }

    public long observations() {
        return observations;
    }

    /**
     * Nominal coverage the controller steers towards.
     */
    public double nominalCoverage() {
        return 1.0 - config.alphaBase();
    }

    public CalibrationState snapshot() {
        return new CalibrationState(currentAlpha, alphaTarget, coverageEma, missStreak,
            scores.snapshot(), inflationFactor, cooldownCounter, observations);
    }

    /**
     * Resume from a snapshot. Out-of-range values are clamped into their valid range.
     */
    public void restore(CalibrationState state) {
        if (state == null) {
            return;
        }
        alphaTarget = clip(positiveOr(state.alphaTarget(), config.alphaBase()));
        currentAlpha = clip(positiveOr(state.currentAlpha(), alphaTarget));
        coverageEma = Math.max(0.0, Math.min(1.0, finiteOr(state.coverageEma(), 1.0 - config.alphaBase())));
        missStreak = Math.max(0, state.missStreak());
        inflationFactor = Math.max(1.0, Math.min(config.inflationCeiling(), finiteOr(state.inflationFactor(), 1.0)));
        cooldownCounter = Math.max(0, state.cooldownCounter());
        observations = Math.max(0, state.observations());
        scores.restore(state.quantileEstimatorState());
    }

    private static double positiveOr(double value, double fallback) {
        return Double.isFinite(value) && value > 0.0 ? value : fallback;
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}
