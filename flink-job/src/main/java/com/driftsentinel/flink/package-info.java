/**
 * Apache Flink streaming job for Drift Sentinel.
 *
 * <p>
 * This package wires the core drift engine into a Flink pipeline that
 * consumes raw records from Kafka, runs one engine per source key, and
 * publishes alerts, drift metrics and change points back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.driftsentinel.flink.DriftSentinelJob}: main entry point</li>
 * <li>{@link com.driftsentinel.flink.DriftProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.driftsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.flink;
