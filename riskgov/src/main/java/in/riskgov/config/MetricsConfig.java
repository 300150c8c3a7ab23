package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import static in.riskgov.config.ConfigChecks.require;

/**
 * Telemetry export settings.
 */
public record MetricsConfig(
    @JsonProperty("httpEnabled")
    boolean httpEnabled,

    @JsonProperty("host")
    String host,

    @JsonProperty("port")
    int port,

    @JsonProperty("profile")
    String profile              // value of the "profile" label on every series
) {
    public static MetricsConfig defaults() {
        return new MetricsConfig(true, "0.0.0.0", 9464, "default");
    }

    public MetricsConfig withPort(int newPort) {
        return new MetricsConfig(httpEnabled, host, newPort, profile);
    }

    public MetricsConfig withProfile(String newProfile) {
        return new MetricsConfig(httpEnabled, host, port, newProfile);
    }

    public void validate() {
        require(host != null && !host.isBlank(), "metrics.host", "is missing");
        require(port > 0 && port < 65536, "metrics.port", "must be a valid TCP port, got " + port);
        require(profile != null && !profile.isBlank(), "metrics.profile", "is missing");
    }
}
