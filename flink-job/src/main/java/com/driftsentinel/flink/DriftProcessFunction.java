package com.driftsentinel.flink;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.engine.DriftEngine;
import com.driftsentinel.core.engine.WindowEvaluation;
import com.driftsentinel.core.metrics.EngineMetrics;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Window;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.flink.api.common.ExecutionConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.java.typeutils.runtime.kryo.JavaSerializer;
import org.apache.flink.api.java.typeutils.runtime.kryo.KryoSerializer;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs one {@link DriftEngine} per
 * source key.
 *
 * <p>
 * Samples are routed into the key's engine as they arrive. Each sample
 * registers an event-time timer at the end of its bucket, as the engine's
 * aggregator places it, plus the grace period. When the watermark passes
 * the timer the engine seals every ready bucket and evaluates the sealed
 * windows in order.
 * </p>
 *
 * <h3>Outputs</h3>
 * <ul>
 * <li>main output: emitted {@link Alert}s</li>
 * <li>{@link #METRICS}: every computed {@link DriftMetric}</li>
 * <li>{@link #CHANGE_POINTS}: every detected {@link ChangePoint}</li>
 * </ul>
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<DriftEngine>} holds the engine of each key, so open
 * buckets, the reference, the change-point history and alert cooldowns are
 * part of every checkpoint. Engines are written with Java serialization
 * (see {@link #engineStateDescriptor()}). Pending timers are checkpointed by
 * Flink alongside the state.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftProcessFunction extends KeyedProcessFunction<String, Sample, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DriftProcessFunction.class);

    public static final OutputTag<DriftMetric> METRICS = new OutputTag<DriftMetric>("drift-metrics") {
    };
    public static final OutputTag<ChangePoint> CHANGE_POINTS = new OutputTag<ChangePoint>("change-points") {
    };

    private final DriftConfig config;
    private final long graceMillis;

    /** Flink keyed state holding the per-key engine. */
    private transient ValueState<DriftEngine> engineState;

    /** Counters of every engine on this subtask. */
    private transient EngineMetrics engineMetrics;

    private transient DriftJobMetrics metrics;

    /**
     * @param config validated drift configuration
     */
    public DriftProcessFunction(DriftConfig config) {
        this.config = Objects.requireNonNull(config, "DriftConfig must not be null");
        this.graceMillis = config.getWindow().gracePeriod().toMillis();
    }

    /**
     * Engine state goes through Kryo with a Java-serialization delegate:
     * engines hold immutable JDK collections and commons-math accumulators
     * that Kryo's field serializer cannot rebuild.
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    static ValueStateDescriptor<DriftEngine> engineStateDescriptor() {
        ExecutionConfig serialization = new ExecutionConfig();
        Class javaSerializer = JavaSerializer.class;
        serialization.addDefaultKryoSerializer(DriftEngine.class, javaSerializer);
        return new ValueStateDescriptor<>("drift-engine",
                new KryoSerializer<>(DriftEngine.class, serialization));
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        engineState = getRuntimeContext().getState(engineStateDescriptor());
        engineMetrics = new EngineMetrics(new SimpleMeterRegistry());
        metrics = new DriftJobMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DriftProcessFunction opened for features {}", config.tracked());
    }

    @Override
    public void close() {
        LOG.info("DriftProcessFunction closing; {} alert(s) emitted",
                (long) engineMetrics.count("drift.alerts.emitted"));
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(Sample sample,
            KeyedProcessFunction<String, Sample, Alert>.Context ctx,
            Collector<Alert> out) throws Exception {
        DriftEngine engine = engineFor(ctx.getCurrentKey());

        List<Window> forced = engine.accept(sample);
        metrics.incrementSamplesProcessed();
        evaluate(engine, forced, ctx, out);

        engine.bucketEndOf(sample.getTimestamp()).ifPresent(end ->
                ctx.timerService().registerEventTimeTimer(end.toEpochMilli() + graceMillis));

        // Persist the engine; its buckets and reference changed
        engineState.update(engine);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, Sample, Alert>.OnTimerContext ctx,
            Collector<Alert> out) throws Exception {
        DriftEngine engine = engineFor(ctx.getCurrentKey());
        evaluate(engine, engine.tick(Instant.ofEpochMilli(timestamp)), ctx, out);
        engineState.update(engine);
    }

    private void evaluate(DriftEngine engine, List<Window> windows,
            KeyedProcessFunction<String, Sample, Alert>.Context ctx, Collector<Alert> out) {
        for (Window window : windows) {
            long startNanos = System.nanoTime();
            WindowEvaluation evaluation = engine.evaluate(window);

            for (DriftMetric metric : evaluation.getMetrics()) {
                ctx.output(METRICS, metric);
            }
            for (ChangePoint cp : evaluation.getChangePoints()) {
                ctx.output(CHANGE_POINTS, cp);
            }
            for (Alert alert : evaluation.getAlerts()) {
                out.collect(alert);
                metrics.incrementAlertsEmitted();
                LOG.info("Alert emitted: key={} feature={} kind={} severity={}", ctx.getCurrentKey(),
                        alert.getFeature(), alert.getKind().getConfigName(), alert.getSeverity());
            }

            metrics.incrementWindowsEvaluated();
            metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
        }
    }

    private DriftEngine engineFor(String key) throws Exception {
        DriftEngine engine = engineState.value();
        if (engine == null) {
            LOG.info("Creating drift engine for key '{}'", key);
            engine = new DriftEngine(config, engineMetrics);
        } else {
            // restored or re-read engines count into a private registry
            engine.bindMetrics(engineMetrics);
        }
        return engine;
    }
}
