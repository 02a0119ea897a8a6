/**
 * Composition of the drift components and their concurrent runtime.
 *
 * <p>
 * {@link com.driftsentinel.core.engine.DriftEngine} is the synchronous
 * composition used by embedding hosts such as the Flink job;
 * {@link com.driftsentinel.core.engine.DriftPipeline} adds bounded queues and
 * worker threads for standalone use.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.engine;
