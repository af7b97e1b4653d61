/* (C)2026 */
package com.ammann.carbon.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Static optimization advice for a grid region.
 *
 * <p>Hours are hours of day in the region's local time.
 */
@Schema(description = "Region-specific optimization strategy")
public record RegionalStrategyDTO(
        @Schema(description = "Grid zone", example = "PL") String region,
        @Schema(description = "Dominant generation source", example = "coal") String primaryEnergySource,
        @Schema(description = "Hours of day that are usually cleanest") List<Integer> optimalHours,
        @Schema(description = "Hours of day that are usually dirtiest") List<Integer> avoidanceHours,
        @Schema(description = "Weekday and weekend intensity differ noticeably") boolean weekdayWeekendDifference,
        @Schema(description = "Grid relies heavily on coal") boolean coalHeavyGrid,
        @Schema(description = "Intensity variation level", example = "high") String variationLevel,
        @Schema(description = "Strategic recommendations") List<String> recommendations,
        @Schema(description = "Region is on the high-variation list") boolean highVariation) {

    public RegionalStrategyDTO {
        optimalHours = List.copyOf(optimalHours);
        avoidanceHours = List.copyOf(avoidanceHours);
        recommendations = List.copyOf(recommendations);
    }

    public RegionalStrategyDTO forRegion(String requestedRegion, boolean isHighVariation) {
        return new RegionalStrategyDTO(
                requestedRegion,
                primaryEnergySource,
                optimalHours,
                avoidanceHours,
                weekdayWeekendDifference,
                coalHeavyGrid,
                variationLevel,
                recommendations,
                isHighVariation);
    }
}
