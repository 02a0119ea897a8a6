/**
 * Baseline distributions and the policies that keep them current.
 *
 * <p>
 * A {@link com.driftsentinel.core.reference.ReferenceDistribution} is an
 * immutable snapshot; {@link com.driftsentinel.core.reference.ReferenceManager}
 * replaces it atomically under the configured
 * {@link com.driftsentinel.core.reference.ReferencePolicy}.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.reference;
