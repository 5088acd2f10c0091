/**
 * Supervised calibration of the ensemble on a held-out validation split.
 *
 * <p>
 * {@link com.supplysentinel.core.calibration.RecalibrationEngine} re-derives
 * detector weights; {@link com.supplysentinel.core.calibration.ThresholdOptimizer}
 * picks the decision threshold (or quorum) for one configured
 * {@link com.supplysentinel.core.calibration.ThresholdObjective}.
 * </p>
 *
 * @since 1.0.0
 */
package com.supplysentinel.core.calibration;
