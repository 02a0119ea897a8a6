/**
 * Penalised change-point segmentation over a per-window scalar series.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.changepoint;
