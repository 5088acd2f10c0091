package com.supplysentinel.core.ensemble;

/**
 * Raised when input has a different column count than the data the ensemble
 * was fitted on.
 *
 * @since 1.0.0
 */
public class SchemaMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int expectedColumns;
    private final int actualColumns;

    public SchemaMismatchException(int expectedColumns, int actualColumns) {
        super(String.format("Ensemble was fitted on %d column(s), input has %d",
                expectedColumns, actualColumns));
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }

    public int getExpectedColumns() {
        return expectedColumns;
    }

    public int getActualColumns() {
        return actualColumns;
    }
}
