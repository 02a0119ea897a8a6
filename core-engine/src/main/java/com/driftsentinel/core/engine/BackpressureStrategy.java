package com.driftsentinel.core.engine;

import java.util.Locale;

/**
 * What ingestion does when the sealed-window queue is full.
 *
 * @since 1.0.0
 */
public enum BackpressureStrategy {

    /** Ingestion waits for queue space up to the offer timeout, then sheds. */
    BLOCK,

    /** The window is shed immediately. */
    SHED;

    public static BackpressureStrategy fromConfig(String value) {
        if ("block".equalsIgnoreCase(value)) {
            return BLOCK;
        }
        if ("shed".equalsIgnoreCase(value)) {
            return SHED;
        }
        throw new IllegalArgumentException("backpressure must be 'block' or 'shed', got: '"
                + (value == null ? null : value.toLowerCase(Locale.ROOT)) + "'");
    }
}
