package in.riskgov.service.uncertainty;

import in.riskgov.config.AggregatorConfig;
import in.riskgov.domain.acceptance.UncertaintyScore;
import in.riskgov.domain.forecast.IntervalPrediction;

import java.util.List;

/**
 * Folds calibration state, model confidence and interval width into kappa and,
 * with coverage compliance, kappa_plus. Stateless; safe to share.
 */
public final class UncertaintyAggregator {

    private final AggregatorConfig config;

    public UncertaintyAggregator(AggregatorConfig config) {
        this.config = config;
    }

    public UncertaintyScore aggregate(IntervalPrediction interval,
                                      List<Double> modelConfidence,
                                      double coverageEma,
                                      double alphaTarget,
                                      int missStreak,
                                      double bccEstimate) {
        double stateU = stateUncertainty(coverageEma, alphaTarget, missStreak);
        double modelU = modelUncertainty(modelConfidence);
        double forecastU = forecastUncertainty(interval);

        double kappa = clip01(config.weightState() * stateU
            + config.weightModel() * modelU
            + config.weightForecast() * forecastU);
        double bcc = clip01(Double.isFinite(bccEstimate) ? bccEstimate : 1.0);
        double kappaPlus = clip01(config.gamma() * kappa + (1.0 - config.gamma()) * (1.0 - bcc));

        return new UncertaintyScore(kappa, kappaPlus, stateU, modelU, forecastU, bcc);
    }

    double stateUncertainty(double coverageEma, double alphaTarget, int missStreak) {
        double gap = Math.max(0.0, (1.0 - alphaTarget) - coverageEma);
        double coverageTerm = gap / config.coverageTolerance();
        double streakTerm = (double) Math.max(0, missStreak) / config.missStreakRef();
        return clip01(Math.max(coverageTerm, streakTerm));
    }

    /**
     * Normalised Shannon entropy; the neutral value when fewer than two usable classes are given.
     */
    double modelUncertainty(List<Double> probabilities) {
        if (probabilities == null || probabilities.size() < 2) {
            return config.modelNeutral();
        }
        double total = 0.0;
        for (Double p : probabilities) {
            if (p != null && Double.isFinite(p) && p > 0.0) {
                total += p;
            }
        }
        if (total <= 0.0) {
            return config.modelNeutral();
        }
        double entropy = 0.0;
        for (Double p : probabilities) {
            if (p != null && Double.isFinite(p) && p > 0.0) {
                double normalised = p / total;
                entropy -= normalised * Math.log(normalised);
            }
        }
        return clip01(entropy / Math.log(probabilities.size()));
    }

    double forecastUncertainty(IntervalPrediction interval) {
        double reference = config.widthRefScale() * Math.max(Math.abs(interval.pointForecast()), 1.0)
            + config.widthRefOffset();
        return Math.min(1.0, interval.width() / reference);
    }

    private static double clip01(double value) {
        if (Double.isNaN(value)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
