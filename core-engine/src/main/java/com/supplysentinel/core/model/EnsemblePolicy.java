package com.supplysentinel.core.model;

import java.util.Locale;

/**
 * Combination policy of an ensemble.
 *
 * @since 1.0.0
 */
public enum EnsemblePolicy {

    /** Weighted average of normalized detector scores, compared to a threshold. */
    WEIGHTED,

    /** Count of anomalous votes, compared to a quorum. */
    QUORUM;

    /**
     * Parse a policy name, case-insensitively.
     *
     * @param name {@code weighted} or {@code quorum}
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static EnsemblePolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Ensemble policy must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ensemble policy: '" + name
                    + "'. Supported: weighted, quorum", e);
        }
    }
}
