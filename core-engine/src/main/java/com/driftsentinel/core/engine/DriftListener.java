package com.driftsentinel.core.engine;

import com.driftsentinel.core.comparison.InsufficientData;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;

/**
 * Callbacks fired by {@link DriftEngine} on the evaluation thread.
 *
 * <p>
 * All methods default to no-ops so listeners implement only what they need.
 * Implementations must be fast; slow work belongs on another thread.
 * </p>
 *
 * @since 1.0.0
 */
public interface DriftListener {

    default void onMetric(DriftMetric metric) {
    }

    default void onChangePoint(ChangePoint changePoint) {
    }

    default void onAlert(Alert alert) {
    }

    default void onInsufficientData(InsufficientData outcome) {
    }
}
