package in.riskgov.service.governance;

import in.riskgov.config.SequentialTestConfig;
import in.riskgov.domain.governance.RollingMetrics;

/**
 * Log-likelihood ratio of H1 (mean mu1) against H0 (mean mu0).
 */
public interface LikelihoodModel {

    /**
     * @param previous LLR before this sample
     * @param x        the new sample
     * @param samples  running statistics, already including {@code x}
     */
    double next(double previous, double x, RollingMetrics samples);

    static LikelihoodModel from(SequentialTestConfig config) {
        switch (config.likelihood()) {
            case GAUSSIAN:
                return new GaussianKnownVariance(config.mu0(), config.mu1(), config.sigma());
            case GLR:
                return new GaussianUnknownVariance(config.mu0(), config.mu1(), config.sigma());
            default:
                throw new IllegalArgumentException("Unknown likelihood " + config.likelihood());
        }
    }

    /**
     * Classic SPRT increment for a Gaussian with known sigma.
     */
    final class GaussianKnownVariance implements LikelihoodModel {
        private final double mu0;
        private final double mu1;
        private final double twoVariance;

        GaussianKnownVariance(double mu0, double mu1, double sigma) {
            this.mu0 = mu0;
            this.mu1 = mu1;
            this.twoVariance = 2.0 * sigma * sigma;
        }

        @Override
        public double next(double previous, double x, RollingMetrics samples) {
            double d0 = x - mu0;
            double d1 = x - mu1;
            return previous + (d0 * d0 - d1 * d1) / twoVariance;
        }
    }

    /**
     * Generalised likelihood ratio with the variance replaced by the running sample
     * variance: n / (2 s^2) * ((mean - mu0)^2 - (mean - mu1)^2). The configured sigma
     * stands in until two samples exist or while the sample variance is degenerate.
     */
    final class GaussianUnknownVariance implements LikelihoodModel {
        private static final double VARIANCE_FLOOR = 1e-12;

        private final double mu0;
        private final double mu1;
        private final double priorVariance;

        GaussianUnknownVariance(double mu0, double mu1, double sigma) {
            this.mu0 = mu0;
            this.mu1 = mu1;
            this.priorVariance = sigma * sigma;
        }

        @Override
        public double next(double previous, double x, RollingMetrics samples) {
            long n = samples.count();
            double variance = samples.variance();
            if (n < 2 || variance <= VARIANCE_FLOOR) {
                variance = priorVariance;
            }
            double d0 = samples.mean() - mu0;
            double d1 = samples.mean() - mu1;
            return n / (2.0 * variance) * (d0 * d0 - d1 * d1);
        }
    }
}
