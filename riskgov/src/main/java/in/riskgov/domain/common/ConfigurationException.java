package in.riskgov.domain.common;

/**
 * Invalid engine configuration. Raised at startup, before any stream exists.
 */
public class ConfigurationException extends RuntimeException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(String.format("[%s] %s", key, message));
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(String.format("[%s] %s", key, message), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
