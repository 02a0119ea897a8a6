package com.driftsentinel.core.alert;

import com.driftsentinel.core.model.Alert;

/**
 * Destination for emitted alerts.
 *
 * <p>
 * Implementations may fail transiently; {@link AlertDispatcher} retries
 * them.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertSink {

    /**
     * @param alert the alert to deliver
     * @throws Exception if delivery failed
     */
    void publish(Alert alert) throws Exception;

    /**
     * @return a short name used in logs
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
