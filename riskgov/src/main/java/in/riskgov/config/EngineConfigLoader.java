package in.riskgov.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.riskgov.domain.common.ConfigurationException;
import in.riskgov.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link EngineConfig} from JSON.
 *
 * Resolution order: built-in defaults, then the bundled {@code riskgov.json} resource,
 * then the file named by {@code RISKGOV_CONFIG}, then single-value environment
 * overrides. Objects are merged key by key so a file only lists what it changes.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String CONFIG_ENV = "RISKGOV_CONFIG";
    public static final String SNAPSHOT_DIR_ENV = "RISKGOV_SNAPSHOT_DIR";
    public static final String METRICS_PORT_ENV = "RISKGOV_METRICS_PORT";
    public static final String PROFILE_ENV = "RISKGOV_PROFILE";
    static final String BUNDLED_RESOURCE = "/riskgov.json";

    private final ObjectMapper mapper;

    public EngineConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Load using the process environment.
     */
    public EngineConfig load() {
        EngineConfig config = loadFrom(resolveConfigPath());
        return applyEnvironment(config);
    }

    /**
     * Load defaults merged with the bundled resource and the given file (may be null).
     */
    public EngineConfig loadFrom(Path file) {
        ObjectNode tree = mapper.valueToTree(EngineConfig.defaults());

        try (InputStream bundled = EngineConfigLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (bundled != null) {
                merge(tree, mapper.readTree(bundled));
                log.info("[EngineConfigLoader] Applied bundled config {}", BUNDLED_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigurationException(BUNDLED_RESOURCE, "unreadable bundled config", e);
        }

        if (file != null) {
            if (!Files.exists(file)) {
                throw new ConfigurationException(CONFIG_ENV, "config file not found: " + file);
            }
            try {
                merge(tree, mapper.readTree(file.toFile()));
                log.info("[EngineConfigLoader] Loaded config from: {}", file);
            } catch (IOException e) {
                throw new ConfigurationException(CONFIG_ENV, "unreadable config file " + file, e);
            }
        } else {
            log.info("[EngineConfigLoader] No config file set, using defaults");
        }

        try {
            return mapper.treeToValue(tree, EngineConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("config", "cannot bind configuration: " + e.getOriginalMessage(), e);
        }
    }

    EngineConfig applyEnvironment(EngineConfig config) {
        EngineConfig result = config;
        String snapshotDir = Env.get(SNAPSHOT_DIR_ENV, null);
        if (snapshotDir != null) {
            result = result.withPersistence(result.persistence().withSnapshotDir(snapshotDir));
        }
        int port = Env.getInt(METRICS_PORT_ENV, -1);
        if (port != -1) {
            result = result.withMetrics(result.metrics().withPort(port));
        }
        String profile = Env.get(PROFILE_ENV, null);
        if (profile != null) {
            result = result.withMetrics(result.metrics().withProfile(profile));
        }
        return result;
    }

    private static Path resolveConfigPath() {
        String path = Env.get(CONFIG_ENV, null);
        return path == null ? null : Paths.get(path);
    }

    private static void merge(ObjectNode target, JsonNode overrides) {
        if (overrides == null || !overrides.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
