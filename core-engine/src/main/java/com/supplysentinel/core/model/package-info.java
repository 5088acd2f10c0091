/**
 * Domain model classes for Supply Sentinel.
 *
 * <ul>
 * <li>{@link com.supplysentinel.core.model.Label}: normal / anomalous class
 * (+1 / -1)</li>
 * <li>{@link com.supplysentinel.core.model.DetectorSpec}: roster entry
 * configuration POJO</li>
 * <li>{@link com.supplysentinel.core.model.TelemetryEvent}: raw telemetry
 * record</li>
 * <li>{@link com.supplysentinel.core.model.AnomalyAlert}: alert published by
 * the streaming job</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.supplysentinel.core.model;
