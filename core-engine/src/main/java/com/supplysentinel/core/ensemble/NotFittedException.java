package com.supplysentinel.core.ensemble;

/**
 * Raised when a prediction or save is attempted before a fit has completed.
 *
 * @since 1.0.0
 */
public class NotFittedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NotFittedException(String message) {
        super(message);
    }
}
