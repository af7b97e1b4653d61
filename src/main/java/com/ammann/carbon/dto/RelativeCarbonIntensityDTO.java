/* (C)2026 */
package com.ammann.carbon.dto;

import com.ammann.carbon.enumeration.RelativeMode;
import com.ammann.carbon.enumeration.TrendDirection;
import com.ammann.carbon.model.CurrentIntensity;
import com.ammann.carbon.model.OptimalWindow;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.model.RelativeClassification;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Current carbon intensity of a region put into the context of its learned pattern.
 *
 * <p>When no pattern is available the relative fields are {@code null} and the confidence score
 * is {@link #DEGRADED_CONFIDENCE}.
 */
@Schema(description = "Current carbon intensity with metrics relative to the region's history")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelativeCarbonIntensityDTO(
        @Schema(description = "Requested region", example = "DE") String location,
        @Schema(description = "Current intensity in g CO2/kWh", example = "120.5") double carbonIntensity,
        @Schema(description = "Renewable share of generation, 0-100", example = "64.2") double renewablePercentage,
        @Schema(description = "Time the reading refers to") Instant timestamp,
        @Schema(description = "Grid zone the region resolved to", example = "DE") String gridZone,
        @Schema(description = "Data provider", example = "electricity_maps") String source,
        @Schema(description = "Share of historical samples cleaner than now, 0-100 (0 = cleanest)")
                Double localPercentile,
        @Schema(description = "Human-readable rank", example = "top 15% cleanest") String dailyRank,
        @Schema(description = "Classification against the region's own P20/P80") RelativeMode relativeMode,
        @Schema(description = "Direction of the long-term trend") TrendDirection trendDirection,
        @Schema(description = "Deviation from the regional mean in percent", example = "-12.4")
                Double trendMagnitude,
        @Schema(description = "Next predicted low-carbon hour") OptimalWindow nextOptimalWindow,
        @Schema(description = "Reliability of the relative metrics, 0-1", example = "0.87") double confidenceScore,
        @Schema(description = "Regional mean intensity in g CO2/kWh") Double regionalBaseline,
        @Schema(description = "Region is on the high-variation list") boolean highVariation) {

    public static final double DEGRADED_CONFIDENCE = 0.5;

    public static RelativeCarbonIntensityDTO of(
            CurrentIntensity current,
            RegionPattern pattern,
            RelativeClassification classification,
            OptimalWindow window,
            double confidence,
            boolean highVariation) {
        return new RelativeCarbonIntensityDTO(
                current.region(),
                current.carbonIntensity(),
                current.renewablePercent(),
                current.timestamp(),
                current.gridZone(),
                current.source(),
                classification.percentile(),
                classification.dailyRank(),
                classification.mode(),
                pattern.trendDirection(),
                classification.trendMagnitude(),
                window,
                confidence,
                pattern.mean(),
                highVariation);
    }

    /** Absolute reading only, used when no pattern could be obtained. */
    public static RelativeCarbonIntensityDTO degraded(CurrentIntensity current, boolean highVariation) {
        return new RelativeCarbonIntensityDTO(
                current.region(),
                current.carbonIntensity(),
                current.renewablePercent(),
                current.timestamp(),
                current.gridZone(),
                current.source(),
                null,
                null,
                null,
                null,
                null,
                null,
                DEGRADED_CONFIDENCE,
                null,
                highVariation);
    }
}
