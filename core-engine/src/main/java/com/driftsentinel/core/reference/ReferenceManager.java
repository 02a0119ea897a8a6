package com.driftsentinel.core.reference;

import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.config.ReferenceSettings;
import com.driftsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the baseline that sealed windows are compared against.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>While no reference exists, {@link #offerBootstrap(Window)} collects the
 * first {@code bootstrapWindows} windows and snapshots them.</li>
 * <li>{@link #snapshot(List)} replaces the baseline on demand.</li>
 * <li>{@link #rollingUpdate(Window)} folds each compared window in according
 * to the {@link ReferencePolicy}.</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every update builds a new {@link ReferenceDistribution} and swaps it in
 * atomically; the published snapshot is never modified. {@link #current()}
 * is lock-free and always returns a consistent version. Updates are
 * serialised on this instance.
 * </p>
 *
 * @since 1.0.0
 */
public class ReferenceManager implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceManager.class);

    private final ReferencePolicy policy;
    private final ReferenceSettings settings;
    private final int histogramBins;
    private final List<String> numericFeatures;
    private final List<String> categoricalFeatures;

    private final AtomicReference<ReferenceDistribution> current = new AtomicReference<>();
    private final List<Window> bootstrapBuffer = new ArrayList<>();
    private final Deque<Window> ring = new ArrayDeque<>();
    private long nextVersion = 1;

    public ReferenceManager(DriftConfig config) {
        this(config.getReference(), config.getComparison().getHistogramBins(),
                config.getNumericFeatures(), config.getCategoricalFeatures());
    }

    public ReferenceManager(ReferenceSettings settings, int histogramBins,
            List<String> numericFeatures, List<String> categoricalFeatures) {
        this.settings = Objects.requireNonNull(settings, "ReferenceSettings must not be null");
        this.policy = ReferencePolicy.fromConfig(settings.getPolicy());
        this.histogramBins = histogramBins;
        this.numericFeatures = List.copyOf(numericFeatures);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
    }

    /**
     * @return the current baseline, empty until one has been established
     */
    public Optional<ReferenceDistribution> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Freeze the given windows as the new baseline.
     *
     * @param windows one or more sealed windows
     * @return the published reference
     */
    public synchronized ReferenceDistribution snapshot(List<Window> windows) {
        return publish(build(windows, Provenance.MANUAL_SNAPSHOT));
    }

    /**
     * Offer a window to the bootstrap buffer. Ignored once a reference exists
     * or when bootstrapping is disabled.
     *
     * @return {@code true} if this window completed the bootstrap reference
     */
    public synchronized boolean offerBootstrap(Window window) {
        Objects.requireNonNull(window, "Window must not be null");
        if (current.get() != null || settings.getBootstrapWindows() == 0) {
            return false;
        }
        bootstrapBuffer.add(window);
        LOG.debug("Bootstrap window {} buffered ({}/{})", window.getIndex(), bootstrapBuffer.size(),
                settings.getBootstrapWindows());
        if (bootstrapBuffer.size() < settings.getBootstrapWindows()) {
            return false;
        }
        publish(build(bootstrapBuffer, Provenance.BOOTSTRAP));
        bootstrapBuffer.clear();
        return true;
    }

    /**
     * Fold a sealed window into the baseline. A no-op under
     * {@link ReferencePolicy#MANUAL} or while no reference exists.
     *
     * @return the new reference, or empty if nothing changed
     */
    public synchronized Optional<ReferenceDistribution> rollingUpdate(Window window) {
        Objects.requireNonNull(window, "Window must not be null");
        ReferenceDistribution base = current.get();
        if (base == null) {
            return Optional.empty();
        }
        return switch (policy) {
            case ROLLING_WINDOWS -> {
                ring.addLast(window);
                while (ring.size() > settings.getRollingWindowCount()) {
                    ring.removeFirst();
                }
                yield Optional.of(publish(build(new ArrayList<>(ring), Provenance.ROLLING_WINDOWS)));
            }
            case EXPONENTIAL_DECAY -> Optional.of(publish(decay(base, window)));
            case MANUAL -> Optional.empty();
        };
    }

    public ReferencePolicy getPolicy() {
        return policy;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ReferenceDistribution publish(ReferenceDistribution next) {
        ReferenceDistribution previous = current.getAndSet(next);
        if (previous == null || next.getProvenance() != previous.getProvenance()) {
            LOG.info("Reference v{} published ({}), valid from {} until {}", next.getVersion(),
                    next.getProvenance(), next.getValidFrom(), next.getValidUntil().orElse(null));
        } else {
            LOG.debug("Reference v{} published ({})", next.getVersion(), next.getProvenance());
        }
        return next;
    }

    private ReferenceDistribution build(List<Window> windows, Provenance provenance) {
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("At least one window is required to build a reference");
        }
        // a fresh snapshot reseeds the rolling buffer
        if (policy == ReferencePolicy.ROLLING_WINDOWS && provenance != Provenance.ROLLING_WINDOWS) {
            ring.clear();
            ring.addAll(windows);
            while (ring.size() > settings.getRollingWindowCount()) {
                ring.removeFirst();
            }
        }

        Map<String, FeatureReference> features = new LinkedHashMap<>();
        for (String feature : numericFeatures) {
            double[] values = windows.stream()
                    .flatMapToDouble(w -> Arrays.stream(w.numericValues(feature)))
                    .toArray();
            features.put(feature, FeatureReference.ofSamples(feature, values, histogramBins,
                    settings.getMaxSamples()));
        }
        for (String feature : categoricalFeatures) {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (Window w : windows) {
                w.categoryCounts(feature).forEach((c, n) -> counts.merge(c, n, Long::sum));
            }
            features.put(feature, FeatureReference.ofCategories(feature, counts));
        }

        Instant newest = windows.stream().map(Window::getEnd).max(Instant::compareTo).orElseThrow();
        return new ReferenceDistribution(nextVersion++, provenance, newest, validUntil(newest), features);
    }

    private ReferenceDistribution decay(ReferenceDistribution base, Window window) {
        double factor = settings.getDecayFactor();
        Map<String, FeatureReference> features = new LinkedHashMap<>();
        base.getFeatures().forEach((name, ref) -> features.put(name, ref.isNumeric()
                ? ref.decayNumeric(factor, window.numericValues(name))
                : ref.decayCategorical(factor, window.categoryCounts(name))));
        Instant newest = window.getEnd().isAfter(base.getValidFrom()) ? window.getEnd() : base.getValidFrom();
        return new ReferenceDistribution(nextVersion++, Provenance.EXPONENTIAL_DECAY, newest,
                validUntil(newest), features);
    }

    private Instant validUntil(Instant from) {
        long seconds = settings.getValiditySeconds();
        return seconds > 0 ? from.plus(Duration.ofSeconds(seconds)) : null;
    }
}
