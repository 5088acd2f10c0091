/**
 * The ensemble facade and its combination layer.
 *
 * <p>
 * {@link com.supplysentinel.core.ensemble.AnomalyEnsemble} owns one
 * {@link com.supplysentinel.core.ensemble.EnsembleState} and runs the
 * detectors of its roster concurrently. Raw detector scores are normalized
 * per detector and per batch by
 * {@link com.supplysentinel.core.ensemble.ScoreNormalizer}, then combined by
 * {@link com.supplysentinel.core.ensemble.WeightedCombiner} or, for
 * agreement counting, by {@link com.supplysentinel.core.ensemble.QuorumCombiner}.
 * </p>
 */
package com.supplysentinel.core.ensemble;
