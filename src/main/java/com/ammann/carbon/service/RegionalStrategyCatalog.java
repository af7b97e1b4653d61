/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.dto.RegionalStrategyDTO;
import com.ammann.carbon.source.GridZoneResolver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;

/**
 * Static optimization strategies for grids whose carbon intensity swings strongly over the day.
 * Regions without a dedicated entry get {@link #DEFAULT_STRATEGY}.
 */
@ApplicationScoped
public class RegionalStrategyCatalog {

    static final RegionalStrategyDTO DEFAULT_STRATEGY = new RegionalStrategyDTO(
            "DEFAULT",
            "mixed",
            List.of(1, 2, 3, 4, 5),
            List.of(17, 18, 19, 20),
            false,
            false,
            "medium",
            List.of(
                    "Schedule batch jobs overnight",
                    "Avoid the evening demand peak",
                    "Use the relative intensity endpoint to react to the current grid state"),
            false);

    private static final Map<String, RegionalStrategyDTO> STRATEGIES = Map.of(
            "PL", new RegionalStrategyDTO(
                    "PL",
                    "coal",
                    List.of(11, 12, 13, 14),
                    List.of(6, 7, 8, 17, 18, 19, 20),
                    true,
                    true,
                    "high",
                    List.of(
                            "Shift flexible load to midday solar hours",
                            "Prefer weekends, when lignite output drops",
                            "Avoid morning and evening peaks served by coal units"),
                    true),
            "US-TEX", new RegionalStrategyDTO(
                    "US-TEX",
                    "natural_gas",
                    List.of(0, 1, 2, 3, 4, 5, 22, 23),
                    List.of(15, 16, 17, 18, 19),
                    false,
                    false,
                    "high",
                    List.of(
                            "Run heavy workloads at night when West Texas wind peaks",
                            "Avoid late afternoon air-conditioning peaks",
                            "Watch for windy fronts, which can push intensity far below average"),
                    true),
            "CN", new RegionalStrategyDTO(
                    "CN",
                    "coal",
                    List.of(11, 12, 13, 14),
                    List.of(18, 19, 20, 21),
                    true,
                    true,
                    "high",
                    List.of(
                            "Align processing with midday solar output",
                            "Avoid evening peaks dominated by coal",
                            "Expect seasonal swings from hydro availability"),
                    true),
            "IN", new RegionalStrategyDTO(
                    "IN",
                    "coal",
                    List.of(10, 11, 12, 13, 14, 15),
                    List.of(19, 20, 21, 22),
                    false,
                    true,
                    "high",
                    List.of(
                            "Use the daytime solar window",
                            "Avoid the evening peak after sunset",
                            "Monsoon months raise wind and hydro share"),
                    true),
            "AU-NSW", new RegionalStrategyDTO(
                    "AU-NSW",
                    "coal",
                    List.of(10, 11, 12, 13, 14),
                    List.of(6, 7, 17, 18, 19, 20),
                    true,
                    true,
                    "high",
                    List.of(
                            "Run workloads during rooftop solar peaks",
                            "Avoid morning and evening ramps",
                            "Weekends around noon are usually the cleanest hours of the week"),
                    true),
            "ZA", new RegionalStrategyDTO(
                    "ZA",
                    "coal",
                    List.of(10, 11, 12, 13, 14),
                    List.of(6, 7, 8, 17, 18, 19, 20),
                    false,
                    true,
                    "high",
                    List.of(
                            "Target midday hours with solar support",
                            "Avoid peak demand hours that add diesel peakers",
                            "Plan around scheduled load shedding"),
                    true));

    @Inject IntelligenceSettings settings = IntelligenceSettings.defaults();

    /**
     * Returns the strategy for {@code region}, resolving free-text locations to grid zones first.
     *
     * @throws IllegalArgumentException if {@code region} is blank
     */
    public RegionalStrategyDTO strategyFor(String region) {
        String zone = GridZoneResolver.resolve(region);
        RegionalStrategyDTO strategy = STRATEGIES.getOrDefault(zone, DEFAULT_STRATEGY);
        boolean highVariation = settings.isHighVariationRegion(region) || settings.isHighVariationRegion(zone);
        return strategy.forRegion(zone, highVariation);
    }

    public boolean hasDedicatedStrategy(String region) {
        return STRATEGIES.containsKey(GridZoneResolver.resolve(region));
    }
}
