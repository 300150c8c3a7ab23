package in.riskgov.domain.common;

/**
 * Thrown when a caller hands the engine a value it cannot use: a non-positive
 * sigma, a non-monotonic timestamp, a ground truth with no pending forecast.
 * The component's state is left unchanged.
 */
public class InvalidInputException extends RuntimeException {

    private final String source;

    public InvalidInputException(String source, String message) {
        super(String.format("[%s] %s", source, message));
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
