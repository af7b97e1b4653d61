/* (C)2026 */
package com.ammann.carbon.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single historical grid carbon-intensity measurement.
 *
 * @param timestamp        measurement time
 * @param carbonIntensity  intensity in g CO2/kWh, never negative
 * @param renewablePercent renewable share of generation, 0-100
 */
public record HistoricalSample(Instant timestamp, double carbonIntensity, double renewablePercent) {

    public HistoricalSample {
        Objects.requireNonNull(timestamp, "timestamp");
        if (carbonIntensity < 0 || Double.isNaN(carbonIntensity)) {
            throw new IllegalArgumentException(
                    "carbonIntensity must be >= 0 but was " + carbonIntensity);
        }
        if (renewablePercent < 0 || renewablePercent > 100) {
            throw new IllegalArgumentException(
                    "renewablePercent must be within [0, 100] but was " + renewablePercent);
        }
    }
}
