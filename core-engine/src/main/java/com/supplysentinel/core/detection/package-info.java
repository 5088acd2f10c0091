/**
 * Base-detector capability and its adapters.
 *
 * <p>
 * All detectors implement {@link com.supplysentinel.core.detection.BaseDetector}
 * and are instantiated via
 * {@link com.supplysentinel.core.detection.DetectorFactory}. Built-in
 * families:
 * </p>
 * <ul>
 * <li>{@link com.supplysentinel.core.detection.IsolationForestDetector}:
 * isolation trees</li>
 * <li>{@link com.supplysentinel.core.detection.MahalanobisDensityDetector}:
 * Gaussian density</li>
 * <li>{@link com.supplysentinel.core.detection.RobustZscoreDetector}:
 * median/MAD boundary</li>
 * <li>{@link com.supplysentinel.core.detection.PcaReconstructionDetector}:
 * principal-subspace reconstruction</li>
 * <li>{@link com.supplysentinel.core.detection.DbscanDetector}: density
 * clustering, binary flag only</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a family, implement {@code BaseDetector} (usually by extending
 * {@code AbstractDetector}), register it in {@code DetectorFactory.create()}
 * and in the {@code @JsonSubTypes} list of {@code BaseDetector}.
 * </p>
 *
 * @since 1.0.0
 */
package com.supplysentinel.core.detection;
