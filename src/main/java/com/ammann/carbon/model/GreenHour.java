/* (C)2026 */
package com.ammann.carbon.model;

import java.time.Instant;

/**
 * One forecast hour considered suitable for energy-intensive work.
 *
 * @param start            inclusive start of the hour
 * @param end              exclusive end of the hour
 * @param carbonIntensity  forecast intensity in g CO2/kWh
 * @param renewablePercent forecast renewable share, 0-100
 * @param confidence       forecast confidence on a 0-100 scale
 */
public record GreenHour(
        Instant start,
        Instant end,
        double carbonIntensity,
        double renewablePercent,
        double confidence) {

    /**
     * Returns a copy of this hour with its confidence multiplied by {@code factor}.
     */
    public GreenHour withConfidenceScaledBy(double factor) {
        return new GreenHour(start, end, carbonIntensity, renewablePercent, confidence * factor);
    }
}
