/**
 * Record validation and normalisation.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.ingest;
