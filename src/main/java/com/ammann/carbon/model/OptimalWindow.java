/* (C)2026 */
package com.ammann.carbon.model;

import java.time.Instant;

/**
 * Predicted one-hour interval with the lowest expected carbon intensity.
 *
 * @param start             window start, always on a full hour
 * @param end               {@code start} plus one hour
 * @param expectedIntensity historical hourly average for the selected hour
 * @param confidence        pattern confidence in [0, 1]
 * @param reason            human-readable explanation, not used in comparisons
 */
public record OptimalWindow(
        Instant start, Instant end, double expectedIntensity, double confidence, String reason) {}
