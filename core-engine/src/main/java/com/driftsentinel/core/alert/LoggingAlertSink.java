package com.driftsentinel.core.alert;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console channel: writes each alert to the log.
 *
 * @since 1.0.0
 */
public class LoggingAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void publish(Alert alert) {
        if (alert.getSeverity() == Severity.CRITICAL) {
            LOG.warn("[DRIFT {}] {} at {}: {}", alert.getSeverity(), alert.getFeature(), alert.getTimestamp(),
                    alert.getDetails());
        } else {
            LOG.info("[DRIFT {}] {} at {}: {}", alert.getSeverity(), alert.getFeature(), alert.getTimestamp(),
                    alert.getDetails());
        }
    }

    @Override
    public String name() {
        return "console";
    }
}
