package com.driftsentinel.core.window;

import com.driftsentinel.core.model.Window;

import java.util.List;

/**
 * Outcome of routing one sample into the aggregator.
 *
 * @since 1.0.0
 */
public final class IngestResult {

    private static final IngestResult LATE = new IngestResult(false, List.of());

    private final boolean accepted;
    private final List<Window> forcedWindows;

    private IngestResult(boolean accepted, List<Window> forcedWindows) {
        this.accepted = accepted;
        this.forcedWindows = List.copyOf(forcedWindows);
    }

    static IngestResult accepted(List<Window> forcedWindows) {
        return new IngestResult(true, forcedWindows);
    }

    static IngestResult late() {
        return LATE;
    }

    /**
     * @return {@code false} if the sample was dropped as late
     */
    public boolean isAccepted() {
        return accepted;
    }

    public boolean isLate() {
        return !accepted;
    }

    /**
     * @return windows force-sealed because the open-window bound was exceeded,
     *         in start order
     */
    public List<Window> getForcedWindows() {
        return forcedWindows;
    }

    @Override
    public String toString() {
        return "IngestResult{accepted=" + accepted + ", forcedWindows=" + forcedWindows.size() + '}';
    }
}
