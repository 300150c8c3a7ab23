package in.riskgov.config;

import in.riskgov.domain.common.ConfigurationException;

final class ConfigChecks {

    static void require(boolean condition, String key, String message) {
        if (!condition) {
            throw new ConfigurationException(key, message);
        }
    }

    static void requireProbability(double value, String key) {
        require(Double.isFinite(value) && value > 0.0 && value < 1.0, key, "must lie in (0, 1), got " + value);
    }

    static void requireUnit(double value, String key) {
        require(Double.isFinite(value) && value >= 0.0 && value <= 1.0, key, "must lie in [0, 1], got " + value);
    }

    static void requirePositive(double value, String key) {
        require(Double.isFinite(value) && value > 0.0, key, "must be positive, got " + value);
    }

    static void requireNonNull(Object value, String key) {
        require(value != null, key, "is missing");
    }

    private ConfigChecks() {}
}
