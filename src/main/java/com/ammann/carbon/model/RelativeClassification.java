/* (C)2026 */
package com.ammann.carbon.model;

import com.ammann.carbon.enumeration.RelativeMode;

/**
 * Position of a single reading relative to a regional pattern.
 *
 * @param percentile     share of pattern samples strictly below the reading, 0-100, one decimal
 * @param mode           clean / average / dirty against the P20/P80 thresholds
 * @param dailyRank      human-readable rank, e.g. {@code "top 15% cleanest"}
 * @param trendMagnitude deviation from the regional mean in percent
 */
public record RelativeClassification(
        double percentile, RelativeMode mode, String dailyRank, double trendMagnitude) {}
