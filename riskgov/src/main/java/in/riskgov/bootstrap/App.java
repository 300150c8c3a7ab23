package in.riskgov.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.riskgov.application.service.RiskEngine;
import in.riskgov.config.EngineConfig;
import in.riskgov.config.EngineConfigLoader;
import in.riskgov.infrastructure.metrics.PrometheusMetricsHandler;
import in.riskgov.infrastructure.metrics.PrometheusRiskMetrics;
import in.riskgov.infrastructure.persistence.FileSnapshotStore;
import in.riskgov.infrastructure.persistence.JsonMappers;
import in.riskgov.infrastructure.persistence.SnapshotWriter;
import in.riskgov.transport.http.GovernanceStatusHandler;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Process entry point: load and validate configuration, restore state, start the
 * snapshot writer and the HTTP endpoints.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        EngineConfig config = new EngineConfigLoader(JsonMappers.configMapper()).load();
        Running running = start(config, CollectorRegistry.defaultRegistry);
        Runtime.getRuntime().addShutdownHook(new Thread(running::stop, "riskgov-shutdown"));
    }

    /**
     * Start an engine with the given configuration.
     *
     * @throws in.riskgov.domain.common.ConfigurationException if the configuration is invalid
     */
    public static Running start(EngineConfig config, CollectorRegistry registry) {
        StartupConfigValidator.validate(config);

        ObjectMapper snapshotMapper = JsonMappers.snapshotMapper();
        PrometheusRiskMetrics metrics = new PrometheusRiskMetrics(registry, config.metrics().profile());
        FileSnapshotStore store = new FileSnapshotStore(Paths.get(config.persistence().snapshotDir()), snapshotMapper);
        SnapshotWriter writer = new SnapshotWriter(store, config.persistence(), metrics, Clock.systemUTC());

        RiskEngine engine = new RiskEngine(config, metrics, store, writer, Clock.systemUTC(), System::nanoTime);
        engine.restore();
        writer.start();
        log.info("✓ Risk engine ready (profile {})", config.metrics().profile());

        Undertow server = null;
        if (config.metrics().httpEnabled()) {
            GovernanceStatusHandler status = new GovernanceStatusHandler(engine, snapshotMapper);
            RoutingHandler routes = Handlers.routing()
                .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
                .get("/health", status::health)
                .get("/api/governance/ledger", status::ledger)
                .get("/api/governance/policies", status::policies)
                .get("/api/streams", status::streams);
            server = Undertow.builder()
                .addHttpListener(config.metrics().port(), config.metrics().host())
                .setHandler(routes)
                .build();
            server.start();
            log.info("✓ HTTP endpoints on http://{}:{}/ (/metrics, /health, /api/governance/*)",
                config.metrics().host(), config.metrics().port());
        }
        return new Running(engine, writer, server);
    }

    /**
     * Handle on a started engine.
     */
    public static final class Running {
        private final RiskEngine engine;
        private final SnapshotWriter writer;
        private final Undertow server;

        Running(RiskEngine engine, SnapshotWriter writer, Undertow server) {
            this.engine = engine;
            this.writer = writer;
            this.server = server;
        }

        public RiskEngine engine() {
            return engine;
        }

        public synchronized void stop() {
            log.info("Shutting down risk engine...");
            engine.snapshotAll();
            writer.stop();
            if (server != null) {
                server.stop();
            }
            log.info("✓ Risk engine stopped");
        }
    }

    private App() {}
}
