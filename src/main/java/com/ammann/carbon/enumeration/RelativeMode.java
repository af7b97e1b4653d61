/* (C)2026 */
package com.ammann.carbon.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a reading against the regional P20/P80 thresholds.
 */
public enum RelativeMode {
    CLEAN("clean"),
    AVERAGE("average"),
    DIRTY("dirty");

    private final String label;

    RelativeMode(String label) {
        this.label = label;
    }

    /**
     * Classifies {@code value}: at or below {@code p20} is clean, at or above {@code p80} is dirty.
     * The clean check runs first, so a degenerate pattern with {@code p20 == p80} reports clean.
     */
    public static RelativeMode classify(double value, double p20, double p80) {
        if (value <= p20) return CLEAN;
        if (value >= p80) return DIRTY;
        return AVERAGE;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
