/**
 * Threshold evaluation, alert rate limiting and alert delivery.
 *
 * <p>
 * {@link com.driftsentinel.core.alert.AlertManager} decides whether an alert
 * is emitted; {@link com.driftsentinel.core.alert.AlertDispatcher} delivers
 * emitted alerts to {@link com.driftsentinel.core.alert.AlertSink}s.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.alert;
