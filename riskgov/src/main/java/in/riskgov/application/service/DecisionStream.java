package in.riskgov.application.service;

import in.riskgov.application.port.output.SnapshotPublisher;
import in.riskgov.config.EngineConfig;
import in.riskgov.domain.acceptance.AcceptanceStep;
import in.riskgov.domain.acceptance.CycleDecision;
import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.UncertaintyScore;
import in.riskgov.domain.common.InvalidInputException;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.execution.ExecutionDecision;
import in.riskgov.domain.forecast.Forecast;
import in.riskgov.domain.forecast.GroundTruth;
import in.riskgov.domain.forecast.IntervalPrediction;
import in.riskgov.domain.snapshot.StreamSnapshot;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import in.riskgov.service.acceptance.AcceptanceOrchestrator;
import in.riskgov.service.acceptance.GuardMetricsTracker;
import in.riskgov.service.acceptance.Surprisal;
import in.riskgov.service.calibration.AdaptiveConformalCalibrator;
import in.riskgov.service.execution.ExecutionRiskGate;
import in.riskgov.service.uncertainty.CoverageComplianceTracker;
import in.riskgov.service.uncertainty.UncertaintyAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * One decision stream: forecast in, calibrated interval, uncertainty score, posture
 * and sized decision out. Ground truths are matched to pending forecasts by timestamp.
 *
 * Calls are serialised on the stream. Streams share nothing mutable with each other.
 */
public final class DecisionStream {
    private static final Logger log = LoggerFactory.getLogger(DecisionStream.class);

    private final String streamId;
    private final EngineConfig config;
    private final AdaptiveConformalCalibrator calibrator;
    private final CoverageComplianceTracker coverage;
    private final GuardMetricsTracker guardMetrics;
    private final UncertaintyAggregator aggregator;
    private final AcceptanceOrchestrator orchestrator;
    private final ExecutionRiskGate gate;
    private final RiskMetrics metrics;
    private final SnapshotPublisher publisher;
    private final LongSupplier nanoClock;
    private final long budgetNanos;

    private final LinkedHashMap<Instant, IntervalPrediction> pending = new LinkedHashMap<>();
    private Instant lastForecastTs;
    private CycleDecision lastDecision;
    private long cycles;

    public DecisionStream(String streamId, EngineConfig config, UncertaintyAggregator aggregator,
                          ExecutionRiskGate gate, RiskMetrics metrics, SnapshotPublisher publisher,
                          LongSupplier nanoClock) {
        this.streamId = streamId;
        this.config = config;
        this.calibrator = new AdaptiveConformalCalibrator(streamId, config.calibration(), config.quantile());
        this.coverage = new CoverageComplianceTracker(config.aggregator(), calibrator.nominalCoverage());
        this.guardMetrics = new GuardMetricsTracker(config.acceptance());
        this.aggregator = aggregator;
        this.orchestrator = new AcceptanceOrchestrator(streamId, config.acceptance(), metrics);
        this.gate = gate;
        this.metrics = metrics;
        this.publisher = publisher;
        this.nanoClock = nanoClock;
        this.budgetNanos = TimeUnit.MILLISECONDS.toNanos(config.stream().cycleBudgetMs());
    }

    /**
     * Run one decision cycle.
     *
     * @throws InvalidInputException for a missing or non-increasing timestamp or an unusable
     *                               forecast; the stream is left unchanged
     */
    public synchronized CycleDecision process(Forecast forecast) {
        long started = nanoClock.getAsLong();
        Instant ts = forecast.timestamp();
        if (ts == null) {
            throw new InvalidInputException(streamId, "forecast timestamp is missing");
        }
        if (lastForecastTs != null && !ts.isAfter(lastForecastTs)) {
            throw new InvalidInputException(streamId,
                "forecast timestamp " + ts + " is not after " + lastForecastTs);
        }

        IntervalPrediction interval = calibrator.predictInterval(ts, forecast.pointForecast(), forecast.sigmaHat(),
            forecast.regimeTransition(), forecast.aciEma());
        lastForecastTs = ts;
        remember(interval);

        guardMetrics.recordLatency(forecast.latencyMs());
        metrics.observeLatency(forecast.latencyMs());
        double relativeWidth = interval.width()
            / Math.max(Math.abs(interval.pointForecast()), config.acceptance().relativeWidthFloor());
        metrics.observeRelativeWidth(relativeWidth);

        UncertaintyScore score = aggregator.aggregate(interval, forecast.modelConfidence(),
            calibrator.coverageEma(), calibrator.alphaTarget(), calibrator.missStreak(), coverage.estimate());
        metrics.updateUncertainty(score.kappa(), score.kappaPlus());
        metrics.updateCalibration(calibrator.currentAlpha(), calibrator.coverageEma());

        if (nanoClock.getAsLong() - started > budgetNanos) {
            return stale(ts, score, interval);
        }

        Map<GuardKind, Double> values = new EnumMap<>(GuardKind.class);
        values.put(GuardKind.COVERAGE_EMA, calibrator.observations() > 0 ? calibrator.coverageEma() : Double.NaN);
        values.put(GuardKind.COVERAGE_MISS_STREAK, (double) calibrator.missStreak());
        values.put(GuardKind.LATENCY_P95, guardMetrics.latencyP95());
        values.put(GuardKind.SURPRISAL_P95, guardMetrics.surprisalP95());
        values.put(GuardKind.RELATIVE_INTERVAL_WIDTH, relativeWidth);
        values.put(GuardKind.KAPPA, score.kappa());
        values.put(GuardKind.KAPPA_PLUS, score.kappaPlus());

        AcceptanceStep step = orchestrator.evaluate(ts, values);
        ExecutionDecision execution = gate.decide(step.posture(), step.evaluations(), forecast.baseNotional());

        CycleDecision decision = new CycleDecision(streamId, ts, step.posture(), execution.riskScale(),
            execution.recommendedNotional(), execution.blockReason(), score.kappa(), score.kappaPlus(),
            calibrator.currentAlpha(), calibrator.coverageEma(), interval, step.evaluations(),
            step.transition(), false);
        lastDecision = decision;

        cycles++;
        if (cycles % config.stream().snapshotEveryCycles() == 0) {
            publisher.publish(snapshot());
        }
        return decision;
    }

    /**
     * Score a realised value against the forecast with the same timestamp.
     *
     * @return true if the interval covered the value
     * @throws InvalidInputException if no forecast with that timestamp is pending
     */
    public synchronized boolean onGroundTruth(GroundTruth truth) {
        if (truth.timestamp() == null || !Double.isFinite(truth.observedValue())) {
            throw new InvalidInputException(streamId, "ground truth needs a timestamp and a finite value");
        }
        IntervalPrediction prediction = pending.remove(truth.timestamp());
        if (prediction == null) {
            throw new InvalidInputException(streamId, "no pending forecast for " + truth.timestamp());
        }
        boolean hit = calibrator.onObservation(truth.observedValue(), prediction);
        coverage.update(hit);

        double surprisal = Surprisal.of(truth.observedValue(), prediction.pointForecast(),
            prediction.sigmaHat(), config.acceptance().huberDelta());
        guardMetrics.recordSurprisal(surprisal);
        metrics.observeSurprisal(surprisal);
        metrics.updateCalibration(calibrator.currentAlpha(), calibrator.coverageEma());
        return hit;
    }

    private CycleDecision stale(Instant ts, UncertaintyScore score, IntervalPrediction interval) {
        metrics.recordStaleDecision();
        log.warn("[DecisionStream:{}] Cycle at {} exceeded its {} ms budget; returning previous decision",
            streamId, ts, config.stream().cycleBudgetMs());
        if (lastDecision != null) {
            return lastDecision.asStale(ts);
        }
        return new CycleDecision(streamId, ts, orchestrator.posture(), 0.0, 0.0, BlockReason.STALE_DECISION,
            score.kappa(), score.kappaPlus(), calibrator.currentAlpha(), calibrator.coverageEma(), interval,
            List.of(), null, true);
    }

    private void remember(IntervalPrediction interval) {
        pending.put(interval.timestamp(), interval);
        int capacity = config.stream().pendingCapacity();
        Iterator<Instant> oldest = pending.keySet().iterator();
        while (pending.size() > capacity && oldest.hasNext()) {
            Instant evicted = oldest.next();
            oldest.remove();
            log.debug("[DecisionStream:{}] Dropped unmatched forecast {}", streamId, evicted);
        }
    }

    public synchronized StreamSnapshot snapshot() {
        return new StreamSnapshot(StreamSnapshot.SCHEMA, StreamSnapshot.CURRENT_VERSION, streamId, Instant.now(),
            lastForecastTs, calibrator.snapshot(), orchestrator.snapshot(), coverage.snapshot(),
            guardMetrics.snapshot(), new ArrayList<>(pending.values()));
    }

    /**
     * Resume from a snapshot of this stream.
     *
     * @throws IllegalArgumentException if the snapshot belongs to another schema or stream
     */
    public synchronized void restore(StreamSnapshot snapshot) {
        if (!StreamSnapshot.SCHEMA.equals(snapshot.schema())) {
            throw new IllegalArgumentException("Not a stream snapshot: schema " + snapshot.schema());
        }
        if (!streamId.equals(snapshot.streamId())) {
            throw new IllegalArgumentException("Snapshot of " + snapshot.streamId() + " cannot restore " + streamId);
        }
        if (snapshot.version() > StreamSnapshot.CURRENT_VERSION) {
            log.warn("[DecisionStream:{}] Snapshot version {} is newer than {}; unknown fields ignored",
                streamId, snapshot.version(), StreamSnapshot.CURRENT_VERSION);
        }
        calibrator.restore(snapshot.calibration());
        orchestrator.restore(snapshot.acceptance());
        coverage.restore(snapshot.coverage());
        guardMetrics.restore(snapshot.guardWindows());
        pending.clear();
        for (IntervalPrediction prediction : snapshot.pending()) {
            if (prediction != null && prediction.timestamp() != null) {
                remember(prediction);
            }
        }
        lastForecastTs = snapshot.lastForecastTs();
        lastDecision = null;
        log.info("[DecisionStream:{}] Restored snapshot v{} saved at {} (posture {}, {} pending)",
            streamId, snapshot.version(), snapshot.savedAt(), orchestrator.posture(), pending.size());
    }

    public String streamId() {
        return streamId;
    }

    public synchronized CycleDecision lastDecision() {
        return lastDecision;
    }

    AdaptiveConformalCalibrator calibrator() {
        return calibrator;
    }

    AcceptanceOrchestrator orchestrator() {
        return orchestrator;
    }
}
