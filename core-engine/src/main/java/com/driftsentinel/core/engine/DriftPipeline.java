package com.driftsentinel.core.engine;

import com.driftsentinel.core.alert.AlertDispatcher;
import com.driftsentinel.core.alert.AlertSink;
import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.config.PipelineSettings;
import com.driftsentinel.core.metrics.EngineMetrics;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.RawRecord;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Severity;
import com.driftsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Concurrent runtime around a {@link DriftEngine}.
 *
 * <h3>Threads</h3>
 * <ul>
 * <li>The caller's thread ingests records and seals windows.</li>
 * <li>One evaluation worker takes sealed windows from a bounded queue and
 * evaluates them strictly in sealing order.</li>
 * <li>One dispatch worker takes emitted alerts from a second bounded queue and
 * hands them to the {@link AlertDispatcher}.</li>
 * </ul>
 *
 * <h3>Backpressure</h3>
 * <p>
 * When the window queue is full, {@link BackpressureStrategy#BLOCK} waits up
 * to {@code offerTimeoutMillis} and then sheds the window;
 * {@link BackpressureStrategy#SHED} sheds it at once. Shed windows are logged
 * and counted as {@code drift.windows.shed}.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #close()} stops intake, optionally flushes open buckets, then waits
 * for both queues to drain before stopping the workers. Intake and the
 * closing transition share one lock, so a close from another thread waits
 * for an intake call in progress (including a blocked offer) and every window
 * sealed before the close is queued ahead of the end marker.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DriftPipeline.class);

    private static final Window END_OF_WINDOWS = new Window(Long.MIN_VALUE, Instant.EPOCH,
            Instant.EPOCH.plusMillis(1), List.of(), Map.of(), Map.of(), true);
    private static final Alert END_OF_ALERTS = Alert.builder()
            .severity(Severity.WARNING)
            .feature("")
            .kind(MetricKind.JS_DIVERGENCE)
            .timestamp(Instant.EPOCH)
            .build();

    private final DriftEngine engine;
    private final AlertDispatcher dispatcher;
    private final EngineMetrics metrics;
    private final PipelineSettings settings;
    private final BackpressureStrategy backpressure;

    private final BlockingQueue<Window> windowQueue;
    private final BlockingQueue<Alert> alertQueue;
    private final ExecutorService evaluationWorker;
    private final ExecutorService dispatchWorker;

    private final Object intakeLock = new Object();
    private volatile boolean closed;

    public DriftPipeline(DriftConfig config, List<AlertSink> sinks) {
        this(config, sinks, EngineMetrics.inMemory());
    }

    public DriftPipeline(DriftConfig config, List<AlertSink> sinks, EngineMetrics metrics) {
        Objects.requireNonNull(config, "DriftConfig must not be null");
        this.metrics = Objects.requireNonNull(metrics, "EngineMetrics must not be null");
        this.settings = config.getPipeline();
        this.backpressure = BackpressureStrategy.fromConfig(settings.getBackpressure());
        this.engine = new DriftEngine(config, metrics);
        this.dispatcher = new AlertDispatcher(sinks, config.getAlerts(), metrics);

        this.windowQueue = new ArrayBlockingQueue<>(settings.getWindowQueueCapacity());
        this.alertQueue = new ArrayBlockingQueue<>(settings.getAlertQueueCapacity());
        metrics.registerWindowQueue(windowQueue);

        this.evaluationWorker = Executors.newSingleThreadExecutor(r -> new Thread(r, "drift-evaluation"));
        this.dispatchWorker = Executors.newSingleThreadExecutor(r -> new Thread(r, "drift-dispatch"));
        evaluationWorker.execute(this::evaluationLoop);
        dispatchWorker.execute(this::dispatchLoop);

        LOG.info("Drift pipeline started: windowQueue={}, alertQueue={}, backpressure={}",
                settings.getWindowQueueCapacity(), settings.getAlertQueueCapacity(), backpressure);
    }

    /**
     * Add a listener; it runs on the evaluation worker.
     */
    public void addListener(DriftListener listener) {
        engine.addListener(listener);
    }

    // ---------------------------------------------------------------
    // Intake (caller thread)
    // ---------------------------------------------------------------

    public void ingest(RawRecord record) {
        synchronized (intakeLock) {
            ensureOpen();
            enqueue(engine.accept(record));
        }
    }

    public void ingest(Sample sample) {
        synchronized (intakeLock) {
            ensureOpen();
            enqueue(engine.accept(sample));
        }
    }

    /**
     * Advance the watermark to {@code now} and queue every bucket it seals.
     */
    public void tick(Instant now) {
        synchronized (intakeLock) {
            ensureOpen();
            enqueue(engine.tick(now));
        }
    }

    /**
     * Seal against the largest timestamp seen so far.
     */
    public void tick() {
        synchronized (intakeLock) {
            ensureOpen();
            enqueue(engine.tick());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Drift pipeline is closed");
        }
    }

    private void enqueue(List<Window> windows) {
        for (Window w : windows) {
            boolean queued;
            try {
                queued = backpressure == BackpressureStrategy.BLOCK
                        ? windowQueue.offer(w, settings.getOfferTimeoutMillis(), TimeUnit.MILLISECONDS)
                        : windowQueue.offer(w);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                queued = false;
            }
            if (!queued) {
                metrics.windowShed();
                LOG.warn("Window queue full ({}): shed window {} with {} sample(s)",
                        settings.getWindowQueueCapacity(), w.getIndex(), w.getCount());
            }
        }
    }

    // ---------------------------------------------------------------
    // Workers
    // ---------------------------------------------------------------

    private void evaluationLoop() {
        while (true) {
            Window window;
            try {
                window = windowQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Evaluation worker interrupted with {} window(s) queued", windowQueue.size());
                return;
            }
            if (window == END_OF_WINDOWS) {
                return;
            }
            try {
                for (Alert alert : engine.evaluate(window).getAlerts()) {
                    queueAlert(alert);
                }
            } catch (RuntimeException e) {
                LOG.error("Evaluation of window {} failed", window.getIndex(), e);
            }
        }
    }

    private void queueAlert(Alert alert) {
        try {
            if (!alertQueue.offer(alert, settings.getOfferTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                metrics.alertDropped();
                LOG.error("Alert queue full ({}): dropped {} alert for '{}'", settings.getAlertQueueCapacity(),
                        alert.getSeverity(), alert.getFeature());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.alertDropped();
            LOG.error("Interrupted while queueing {} alert for '{}'", alert.getSeverity(), alert.getFeature());
        }
    }

    private void dispatchLoop() {
        while (true) {
            Alert alert;
            try {
                alert = alertQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Dispatch worker interrupted with {} alert(s) queued", alertQueue.size());
                return;
            }
            if (alert == END_OF_ALERTS) {
                return;
            }
            dispatcher.dispatch(alert);
        }
    }

    // ---------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------

    /**
     * Stop intake, flush open buckets when configured, drain both queues and
     * stop the workers. Idempotent.
     */
    @Override
    public void close() {
        synchronized (intakeLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        // intake is excluded from here on; the aggregator is ours
        long timeout = settings.getShutdownTimeoutSeconds();
        try {
            if (settings.isFlushOnShutdown()) {
                for (Window w : engine.flush()) {
                    windowQueue.put(w);
                }
            }
            windowQueue.put(END_OF_WINDOWS);
            awaitStop(evaluationWorker, "evaluation", timeout);
            alertQueue.put(END_OF_ALERTS);
            awaitStop(dispatchWorker, "dispatch", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            evaluationWorker.shutdownNow();
            dispatchWorker.shutdownNow();
            LOG.warn("Interrupted while closing drift pipeline");
            return;
        }
        LOG.info("Drift pipeline closed");
    }

    private static void awaitStop(ExecutorService worker, String name, long timeoutSeconds)
            throws InterruptedException {
        worker.shutdown();
        if (!worker.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
            LOG.warn("{} worker did not finish within {}s; forcing shutdown", name, timeoutSeconds);
            worker.shutdownNow();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public DriftEngine getEngine() {
        return engine;
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    /**
     * @return sealed windows waiting for evaluation
     */
    public int getQueuedWindowCount() {
        return windowQueue.size();
    }
}
