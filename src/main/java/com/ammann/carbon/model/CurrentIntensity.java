/* (C)2026 */
package com.ammann.carbon.model;

import java.time.Instant;

/**
 * Live carbon-intensity reading for a region as reported by a {@code CarbonDataSource}.
 *
 * @param region           region identifier as requested by the caller
 * @param carbonIntensity  intensity in g CO2/kWh
 * @param renewablePercent renewable share of generation, 0-100
 * @param timestamp        time the reading refers to
 * @param gridZone         grid zone the provider resolved the region to, may be {@code null}
 * @param source           provider name
 */
public record CurrentIntensity(
        String region,
        double carbonIntensity,
        double renewablePercent,
        Instant timestamp,
        String gridZone,
        String source) {}
