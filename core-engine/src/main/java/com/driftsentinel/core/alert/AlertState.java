package com.driftsentinel.core.alert;

import com.driftsentinel.core.model.Severity;

/**
 * Per (feature, metric kind) alert state.
 *
 * @since 1.0.0
 */
public enum AlertState {
    NORMAL,
    WARNED,
    ALERTED;

    static AlertState of(Severity severity) {
        if (severity == null) {
            return NORMAL;
        }
        return severity == Severity.CRITICAL ? ALERTED : WARNED;
    }
}
