/* (C)2026 */
package com.ammann.carbon.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Forecast of green hours for a region over a bounded horizon.
 *
 * @param region      region identifier
 * @param greenHours  hours in chronological order
 * @param bestWindow  lowest-intensity hour, {@code null} when {@code greenHours} is empty
 * @param periodStart start of the forecast horizon
 * @param periodEnd   end of the forecast horizon
 * @param generatedAt creation time of the forecast
 * @param source      provider name
 */
public record GreenHoursForecast(
        String region,
        List<GreenHour> greenHours,
        GreenHour bestWindow,
        Instant periodStart,
        Instant periodEnd,
        Instant generatedAt,
        String source) {

    public GreenHoursForecast {
        greenHours = greenHours == null ? List.of() : List.copyOf(greenHours);
    }

    /**
     * Returns a forecast with the given hours and a best window recomputed from them.
     * The first hour wins ties.
     */
    public GreenHoursForecast withGreenHours(List<GreenHour> hours) {
        return new GreenHoursForecast(
                region, hours, lowestIntensity(hours), periodStart, periodEnd, generatedAt, source);
    }

    /**
     * Returns the lowest-intensity hour of {@code hours}, or {@code null} when empty.
     */
    public static GreenHour lowestIntensity(List<GreenHour> hours) {
        if (hours == null || hours.isEmpty()) {
            return null;
        }
        return hours.stream().min(Comparator.comparingDouble(GreenHour::carbonIntensity)).orElse(null);
    }
}
