/**
 * Configuration loading and validation for Drift Sentinel.
 *
 * <p>
 * The YAML configuration is loaded by
 * {@link com.driftsentinel.core.config.DriftConfigLoader} into a
 * {@link com.driftsentinel.core.config.DriftConfig} instance. Validation is
 * performed automatically after parsing; any problem raises a
 * {@link com.driftsentinel.core.config.ConfigurationException} before data is
 * processed.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.config;
