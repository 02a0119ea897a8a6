package com.driftsentinel.core.window;

import com.driftsentinel.core.config.WindowSettings;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Routes samples into fixed-size time buckets and seals them into immutable
 * {@link Window}s.
 *
 * <h3>Bucket Placement</h3>
 * <p>
 * Bucket {@code i} covers {@code [origin + i*size, origin + (i+1)*size)}. The
 * origin is the UTC epoch for {@link BucketAlignment#CALENDAR} and the first
 * accepted sample's timestamp for {@link BucketAlignment#FIRST_SAMPLE}.
 * </p>
 *
 * <h3>Sealing</h3>
 * <p>
 * Buckets seal in start order and a sealed bucket never reopens. A bucket
 * seals when its end is at or before {@code now - grace}
 * ({@link #sealReadyWindows(Instant)}), when more than
 * {@code maxOpenWindows} buckets are open (oldest first, marked forced), or on
 * {@link #flush()}. Only buckets that received samples produce windows.
 * </p>
 *
 * <h3>Late Samples</h3>
 * <p>
 * A sample is dropped as late when its bucket lies below the sealed frontier,
 * or when it is older than the oldest open bucket's start by more than the
 * grace period.
 * </p>
 *
 * <p>
 * Not thread-safe: one ingestion thread owns an aggregator.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowAggregator implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(WindowAggregator.class);

    private final long sizeMillis;
    private final long graceMillis;
    private final int maxOpenWindows;
    private final BucketAlignment alignment;

    private final TreeMap<Long, OpenWindow> open = new TreeMap<>();

    /** Origin in epoch millis; {@code null} until the first sample under FIRST_SAMPLE. */
    private Long origin;

    /** Every bucket index below this value is sealed. */
    private long frontier = Long.MIN_VALUE;

    private Instant watermark;
    private long lateCount;

    public WindowAggregator(WindowSettings settings) {
        Objects.requireNonNull(settings, "WindowSettings must not be null");
        this.sizeMillis = settings.bucketDuration().toMillis();
        this.graceMillis = settings.gracePeriod().toMillis();
        this.maxOpenWindows = settings.getMaxOpenWindows();
        this.alignment = BucketAlignment.fromConfig(settings.getAlignment());
        if (sizeMillis <= 0) {
            throw new IllegalArgumentException("bucket size must be > 0, got: " + sizeMillis + " ms");
        }
        if (maxOpenWindows < 1) {
            throw new IllegalArgumentException("maxOpenWindows must be >= 1, got: " + maxOpenWindows);
        }
        if (alignment == BucketAlignment.CALENDAR) {
            this.origin = 0L;
        }
    }

    /**
     * Route one sample into its bucket.
     *
     * @param sample the sample; must not be {@code null}
     * @return whether it was accepted, plus any force-sealed windows
     */
    public IngestResult ingest(Sample sample) {
        Objects.requireNonNull(sample, "Sample must not be null");
        long ts = sample.getTimestamp().toEpochMilli();
        if (origin == null) {
            origin = ts;
            LOG.debug("Bucket origin set to first sample at {}", sample.getTimestamp());
        }

        long index = indexOf(ts);
        if (index < frontier || isBeyondGrace(ts)) {
            lateCount++;
            LOG.warn("Dropping late sample at {} (bucket {}, sealed frontier {})",
                    sample.getTimestamp(), index, frontier);
            return IngestResult.late();
        }

        open.computeIfAbsent(index, i -> new OpenWindow(i, startOf(i), startOf(i + 1))).add(sample);
        if (watermark == null || sample.getTimestamp().isAfter(watermark)) {
            watermark = sample.getTimestamp();
        }

        List<Window> forced = new ArrayList<>();
        while (open.size() > maxOpenWindows) {
            Map.Entry<Long, OpenWindow> oldest = open.pollFirstEntry();
            forced.add(seal(oldest.getValue(), true));
        }
        if (!forced.isEmpty()) {
            LOG.warn("Open-window bound {} exceeded: force-sealed {} window(s)", maxOpenWindows, forced.size());
        }
        return IngestResult.accepted(forced);
    }

    /**
     * Seal every bucket whose end is at or before {@code now - grace}.
     *
     * @param now the current watermark
     * @return the sealed windows in start order, possibly empty
     */
    public List<Window> sealReadyWindows(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (origin == null) {
            return List.of();
        }
        long cutoffIndex = indexOf(now.toEpochMilli() - graceMillis);
        List<Window> sealed = new ArrayList<>();
        Iterator<Map.Entry<Long, OpenWindow>> it = open.headMap(cutoffIndex, false).entrySet().iterator();
        while (it.hasNext()) {
            sealed.add(seal(it.next().getValue(), false));
            it.remove();
        }
        // empty buckets behind the cutoff count as sealed too
        frontier = Math.max(frontier, cutoffIndex);
        return sealed;
    }

    /**
     * Seal against the largest accepted timestamp.
     *
     * @return the sealed windows in start order, possibly empty
     */
    public List<Window> sealReadyWindows() {
        return watermark == null ? List.of() : sealReadyWindows(watermark);
    }

    /**
     * Force-seal every open bucket.
     *
     * @return the sealed windows in start order
     */
    public List<Window> flush() {
        List<Window> sealed = new ArrayList<>(open.size());
        while (!open.isEmpty()) {
            sealed.add(seal(open.pollFirstEntry().getValue(), true));
        }
        if (!sealed.isEmpty()) {
            LOG.info("Flushed {} open window(s)", sealed.size());
        }
        return sealed;
    }

    /**
     * End of the bucket that holds {@code timestamp}, under this aggregator's
     * alignment.
     *
     * @return the exclusive bucket end; empty while the origin is unknown,
     *         that is before the first sample under FIRST_SAMPLE
     */
    public Optional<Instant> bucketEndOf(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (origin == null) {
            return Optional.empty();
        }
        return Optional.of(startOf(indexOf(timestamp.toEpochMilli()) + 1));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Optional<Instant> getWatermark() {
        return Optional.ofNullable(watermark);
    }

    public int getOpenWindowCount() {
        return open.size();
    }

    public long getLateCount() {
        return lateCount;
    }

    public BucketAlignment getAlignment() {
        return alignment;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Window seal(OpenWindow bucket, boolean forced) {
        frontier = Math.max(frontier, bucket.getIndex() + 1);
        Window window = bucket.seal(forced);
        LOG.debug("Sealed window {} [{} - {}) with {} sample(s){}", window.getIndex(), window.getStart(),
                window.getEnd(), window.getCount(), forced ? " (forced)" : "");
        return window;
    }

    private boolean isBeyondGrace(long ts) {
        if (open.isEmpty()) {
            return false;
        }
        long oldestStart = open.firstEntry().getValue().getStart().toEpochMilli();
        return ts < oldestStart - graceMillis;
    }

    private long indexOf(long epochMillis) {
        return Math.floorDiv(epochMillis - origin, sizeMillis);
    }

    private Instant startOf(long index) {
        return Instant.ofEpochMilli(origin + index * sizeMillis);
    }
}
