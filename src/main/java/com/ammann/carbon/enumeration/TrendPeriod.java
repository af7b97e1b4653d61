/* (C)2026 */
package com.ammann.carbon.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Reporting period of a carbon trend report.
 *
 * <p>Each period carries the number of days analysed when the caller does not specify one.
 */
public enum TrendPeriod {
    DAILY("daily", 1),
    WEEKLY("weekly", 7),
    MONTHLY("monthly", 30);

    private final String label;
    private final int defaultDays;

    TrendPeriod(String label, int defaultDays) {
        this.label = label;
        this.defaultDays = defaultDays;
    }

    /**
     * Parses a period label case-insensitively.
     *
     * @param value period label such as {@code "weekly"}
     * @return matching period
     * @throws IllegalArgumentException if the label is unknown
     */
    public static TrendPeriod fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TrendPeriod period : values()) {
                if (period.label.equals(normalized)) {
                    return period;
                }
            }
        }
        throw new IllegalArgumentException("Unknown trend period: " + value);
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getDefaultDays() {
        return defaultDays;
    }
}
