package com.supplysentinel.core.model;

/**
 * Ground-truth or predicted class of an observation.
 *
 * <p>
 * Label arrays exchanged with the ensemble use the integer values of this
 * enum: {@code +1} for normal and {@code -1} for anomalous, matching the sign
 * convention of detector decision scores (higher means more normal).
 * </p>
 *
 * @since 1.0.0
 */
public enum Label {

    NORMAL(1),
    ANOMALOUS(-1);

    private final int value;

    Label(int value) {
        this.value = value;
    }

    /**
     * @return {@code +1} for {@link #NORMAL}, {@code -1} for {@link #ANOMALOUS}
     */
    public int value() {
        return value;
    }

    /**
     * Map an integer label to its enum constant.
     *
     * @param value {@code +1} or {@code -1}
     * @return the matching label
     * @throws IllegalArgumentException for any other value
     */
    public static Label fromValue(int value) {
        return switch (value) {
            case 1 -> NORMAL;
            case -1 -> ANOMALOUS;
            default -> throw new IllegalArgumentException(
                    "Label must be +1 (normal) or -1 (anomalous), got: " + value);
        };
    }

    /**
     * @param value integer label
     * @return {@code true} if {@code value} denotes an anomaly
     */
    public static boolean isAnomalous(int value) {
        return value == ANOMALOUS.value;
    }
}
