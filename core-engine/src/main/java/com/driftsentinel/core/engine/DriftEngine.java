package com.driftsentinel.core.engine;

import com.driftsentinel.core.alert.AlertDecision;
import com.driftsentinel.core.alert.AlertManager;
import com.driftsentinel.core.changepoint.ChangePointDetector;
import com.driftsentinel.core.comparison.ComparisonReport;
import com.driftsentinel.core.comparison.DistributionComparator;
import com.driftsentinel.core.comparison.InsufficientData;
import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.ingest.SampleIngestor;
import com.driftsentinel.core.ingest.ValidationException;
import com.driftsentinel.core.metrics.EngineMetrics;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.RawRecord;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Window;
import com.driftsentinel.core.reference.ReferenceDistribution;
import com.driftsentinel.core.reference.ReferenceManager;
import com.driftsentinel.core.window.IngestResult;
import com.driftsentinel.core.window.WindowAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Composes ingestion, windowing, comparison, change-point detection and
 * alerting for one stream.
 *
 * <h3>Two Sides</h3>
 * <p>
 * The ingestion side ({@link #accept(RawRecord)}, {@link #tick(Instant)},
 * {@link #flush()}) turns records into sealed windows. The evaluation side
 * ({@link #evaluate(Window)}) turns each sealed window into metrics, change
 * points and alerts. Each side must be driven by one thread at a time; the
 * two sides share no mutable state, so they may run on different threads as
 * long as windows reach {@link #evaluate(Window)} in sealing order.
 * </p>
 *
 * <h3>Serialization</h3>
 * <p>
 * An engine serializes with its open buckets, reference, change-point
 * history and alert states, so it can live in checkpointed keyed state.
 * Listeners and the metrics binding are not serialized: a restored engine
 * counts into a private in-memory registry until
 * {@link #bindMetrics(EngineMetrics)} is called, and has no listeners.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftEngine implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(DriftEngine.class);

    private final SampleIngestor ingestor;
    private final WindowAggregator aggregator;
    private final ReferenceManager referenceManager;
    private final DistributionComparator comparator;
    private final ChangePointDetector changePointDetector;
    private final AlertManager alertManager;
    private transient EngineMetrics metrics;
    private transient List<DriftListener> listeners = new CopyOnWriteArrayList<>();

    public DriftEngine(DriftConfig config) {
        this(config, EngineMetrics.inMemory());
    }

    public DriftEngine(DriftConfig config, EngineMetrics metrics) {
        Objects.requireNonNull(config, "DriftConfig must not be null");
        this.metrics = Objects.requireNonNull(metrics, "EngineMetrics must not be null");
        this.ingestor = new SampleIngestor(config);
        this.aggregator = new WindowAggregator(config.getWindow());
        this.referenceManager = new ReferenceManager(config);
        this.comparator = new DistributionComparator(config);
        this.changePointDetector = config.getChangePoint().isEnabled()
                ? new ChangePointDetector(config.getChangePoint())
                : null;
        this.alertManager = new AlertManager(config.thresholdConfig(), config.getAlerts());
        LOG.info("Drift engine created: features={}, reference policy={}, change points {}",
                config.tracked(), referenceManager.getPolicy(),
                changePointDetector != null ? "on '" + changePointDetector.getSeriesName() + "'" : "off");
    }

    public void addListener(DriftListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Route this engine's counters into {@code metrics}. Needed after
     * deserialization, when the engine counts into a private registry.
     */
    public void bindMetrics(EngineMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "EngineMetrics must not be null");
    }

    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        metrics = EngineMetrics.inMemory();
        listeners = new CopyOnWriteArrayList<>();
    }

    // ---------------------------------------------------------------
    // Ingestion side
    // ---------------------------------------------------------------

    /**
     * Validate and route one raw record. Invalid records are logged, counted
     * and dropped.
     *
     * @return windows force-sealed by the open-window bound, possibly empty
     */
    public List<Window> accept(RawRecord record) {
        Sample sample;
        try {
            sample = ingestor.ingest(record);
        } catch (ValidationException e) {
            metrics.sampleRejected();
            LOG.warn("Rejected record: {}", e.getMessage());
            return List.of();
        }
        return accept(sample);
    }

    /**
     * @return windows force-sealed by the open-window bound, possibly empty
     */
    public List<Window> accept(Sample sample) {
        IngestResult result = aggregator.ingest(sample);
        if (result.isLate()) {
            metrics.sampleLate();
            return List.of();
        }
        metrics.sampleAccepted();
        return sealed(result.getForcedWindows());
    }

    /**
     * Seal every bucket that ends at or before {@code now} minus the grace
     * period.
     */
    public List<Window> tick(Instant now) {
        return sealed(aggregator.sealReadyWindows(now));
    }

    /**
     * Seal against the largest timestamp seen so far.
     */
    public List<Window> tick() {
        return sealed(aggregator.sealReadyWindows());
    }

    /**
     * @return end of the bucket that holds {@code timestamp}; empty before the
     *         first sample when buckets align to it
     * @see WindowAggregator#bucketEndOf(Instant)
     */
    public Optional<Instant> bucketEndOf(Instant timestamp) {
        return aggregator.bucketEndOf(timestamp);
    }

    /**
     * Force-seal every open bucket.
     */
    public List<Window> flush() {
        return sealed(aggregator.flush());
    }

    private List<Window> sealed(List<Window> windows) {
        for (Window w : windows) {
            metrics.windowSealed(w.isForced());
        }
        return windows;
    }

    // ---------------------------------------------------------------
    // Evaluation side
    // ---------------------------------------------------------------

    /**
     * Compare a sealed window, run change-point detection and evaluate every
     * result against the thresholds.
     *
     * @param window a sealed window, in sealing order
     * @return what the window produced
     */
    public WindowEvaluation evaluate(Window window) {
        Objects.requireNonNull(window, "Window must not be null");

        ReferenceDistribution reference = referenceManager.current().orElse(null);
        boolean bootstrapped = false;
        ComparisonReport report;
        if (reference == null) {
            bootstrapped = referenceManager.offerBootstrap(window);
            report = comparator.compare(window, null);
        } else {
            report = comparator.compare(window, reference);
            referenceManager.rollingUpdate(window);
        }

        List<AlertDecision> decisions = new ArrayList<>();
        for (DriftMetric metric : report.getMetrics()) {
            metrics.metricComputed();
            listeners.forEach(l -> l.onMetric(metric));
            decisions.add(alertManager.evaluate(metric));
        }
        for (InsufficientData outcome : report.getSkipped()) {
            metrics.insufficient(outcome.getReason());
            listeners.forEach(l -> l.onInsufficientData(outcome));
        }

        List<ChangePoint> changePoints = changePointDetector != null
                ? changePointDetector.onWindow(window)
                : List.of();
        for (ChangePoint cp : changePoints) {
            metrics.changePointDetected();
            listeners.forEach(l -> l.onChangePoint(cp));
            decisions.add(alertManager.evaluate(cp, window.getEnd()));
        }

        List<Alert> alerts = new ArrayList<>();
        for (AlertDecision decision : decisions) {
            if (decision.isSuppressed()) {
                metrics.alertSuppressed();
            }
            decision.getAlert().ifPresent(alert -> {
                alerts.add(alert);
                metrics.alertEmitted(alert.getSeverity());
                listeners.forEach(l -> l.onAlert(alert));
            });
        }

        WindowEvaluation evaluation = new WindowEvaluation(window, report, changePoints, decisions, alerts,
                bootstrapped);
        LOG.debug("Evaluated {}", evaluation);
        return evaluation;
    }

    /**
     * Evaluate windows in order.
     */
    public List<WindowEvaluation> evaluateAll(List<Window> windows) {
        List<WindowEvaluation> evaluations = new ArrayList<>(windows.size());
        for (Window w : windows) {
            evaluations.add(evaluate(w));
        }
        return evaluations;
    }

    /**
     * Replace the reference with the given windows.
     */
    public ReferenceDistribution snapshotReference(List<Window> windows) {
        return referenceManager.snapshot(windows);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public ReferenceManager getReferenceManager() {
        return referenceManager;
    }

    public AlertManager getAlertManager() {
        return alertManager;
    }

    public WindowAggregator getAggregator() {
        return aggregator;
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }
}
