package com.supplysentinel.core.ensemble;

/**
 * Lifecycle of an {@link AnomalyEnsemble}.
 *
 * <pre>
 *   UNFITTED ──fit──▶ FITTING ──▶ FITTED
 *                        ▲           │
 *                        └───fit─────┘
 * </pre>
 *
 * <p>
 * A fit in which every detector fails drops back to {@link #UNFITTED}.
 * </p>
 *
 * @since 1.0.0
 */
public enum EnsembleLifecycle {
    UNFITTED,
    FITTING,
    FITTED
}
