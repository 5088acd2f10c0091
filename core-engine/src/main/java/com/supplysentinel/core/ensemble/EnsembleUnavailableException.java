package com.supplysentinel.core.ensemble;

/**
 * Raised when no detector contributed to a batch, so the ensemble has no
 * decision to offer.
 *
 * @since 1.0.0
 */
public class EnsembleUnavailableException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EnsembleUnavailableException(String message) {
        super(message);
    }
}
