/**
 * Apache Flink streaming job for Supply Sentinel.
 *
 * <p>
 * This package wires the core ensemble into a Flink pipeline that consumes
 * supply-chain telemetry from Kafka, scores it in count-window micro-batches
 * and publishes anomaly alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.supplysentinel.flink.SupplySentinelJob}: main entry
 * point</li>
 * <li>{@link com.supplysentinel.flink.EnsembleTrainer}: offline fit that
 * writes the ensemble bundle</li>
 * <li>{@link com.supplysentinel.flink.EnsembleScoringFunction}: window
 * function around {@link com.supplysentinel.flink.BatchScorer}</li>
 * <li>{@link com.supplysentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.supplysentinel.flink.HealthServer}: HTTP health, readiness
 * and roster endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.supplysentinel.flink;
