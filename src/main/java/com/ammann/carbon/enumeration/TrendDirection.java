/* (C)2026 */
package com.ammann.carbon.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of the long-term carbon-intensity trend of a region.
 */
public enum TrendDirection {
    /** Intensity is falling over the sample window. */
    IMPROVING("improving"),
    /** Intensity is rising over the sample window. */
    WORSENING("worsening"),
    /** Slope below the significance threshold. */
    STABLE("stable");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
