package com.supplysentinel.core.ensemble;

/**
 * Raised when no detector of the roster could be fitted.
 *
 * <p>
 * Individual detector failures are contained by the ensemble; this exception
 * only surfaces a total failure. The first detector failure is attached as
 * the cause and the others as suppressed exceptions.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleFitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EnsembleFitException(String message) {
        super(message);
    }

    public EnsembleFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
