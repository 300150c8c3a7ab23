package in.riskgov.bootstrap;

import in.riskgov.config.EngineConfig;
import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.common.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Startup configuration validator.
 *
 * Runs before any stream is created. Any invalid value stops the process: the
 * engine must never serve decisions under a configuration it cannot honour.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws ConfigurationException if the configuration is invalid or the snapshot
     *                                directory cannot be created
     */
    public static void validate(EngineConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        try {
            config.validate();
        } catch (ConfigurationException e) {
            log.error("❌ INVALID CONFIG: {}", e.getMessage());
            log.error("System refuses to start.");
            throw e;
        }
        log.info("✓ Guard thresholds ordered for {} guards", GuardKind.values().length);
        log.info("✓ Alpha budget {} over {} expected tests ({})",
            config.ledger().totalBudget(), config.ledger().expectedTests(), config.ledger().spendingPolicy());
        log.info("✓ kappa_plus gamma = {} (externally validated)", config.aggregator().gamma());

        Path snapshotDir = Paths.get(config.persistence().snapshotDir());
        try {
            Files.createDirectories(snapshotDir);
        } catch (IOException e) {
            log.error("❌ INVALID CONFIG: snapshot directory {} cannot be created", snapshotDir);
            throw new ConfigurationException("persistence.snapshotDir", "cannot create " + snapshotDir, e);
        }
        if (!Files.isWritable(snapshotDir)) {
            log.error("❌ INVALID CONFIG: snapshot directory {} is not writable", snapshotDir);
            throw new ConfigurationException("persistence.snapshotDir", snapshotDir + " is not writable");
        }
        log.info("✓ Snapshot directory {}", snapshotDir.toAbsolutePath());

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
