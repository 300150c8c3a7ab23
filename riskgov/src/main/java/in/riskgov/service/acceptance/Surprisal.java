package in.riskgov.service.acceptance;

/**
 * Robust surprisal of a standardised residual: log1p(3 * huber(r)).
 */
public final class Surprisal {

    private static final double SCALE = 3.0;

    public static double huber(double residual, double delta) {
        double a = Math.abs(residual);
        if (a <= delta) {
            return 0.5 * residual * residual;
        }
        return delta * (a - 0.5 * delta);
    }

    public static double of(double observed, double point, double sigma, double delta) {
        if (!(sigma > 0.0) || !Double.isFinite(observed) || !Double.isFinite(point)) {
            return Double.NaN;
        }
        double r = (observed - point) / sigma;
        return Math.log1p(SCALE * huber(r, delta));
    }

    private Surprisal() {}
}
