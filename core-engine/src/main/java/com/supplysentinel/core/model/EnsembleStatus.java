package com.supplysentinel.core.model;

/**
 * Health of one ensemble evaluation, as reported to batch callers.
 *
 * @since 1.0.0
 */
public enum EnsembleStatus {

    /** Every active detector contributed. */
    HEALTHY,

    /** Some, but not all, active detectors contributed. */
    DEGRADED,

    /** No detector contributed; no decision was produced. */
    UNAVAILABLE
}
