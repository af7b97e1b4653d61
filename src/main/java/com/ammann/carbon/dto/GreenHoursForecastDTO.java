/* (C)2026 */
package com.ammann.carbon.dto;

import com.ammann.carbon.model.GreenHour;
import com.ammann.carbon.model.GreenHoursForecast;
import com.ammann.carbon.model.RegionPattern;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Green hours forecast, filtered by the region's learned thresholds when available")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GreenHoursForecastDTO(
        @Schema(description = "Requested region") String location,
        @Schema(description = "Green hours in chronological order") List<GreenHour> greenHours,
        @Schema(description = "Lowest-intensity green hour") GreenHour bestWindow,
        @Schema(description = "Start of the forecast horizon") Instant periodStart,
        @Schema(description = "End of the forecast horizon") Instant periodEnd,
        @Schema(description = "Creation time of the forecast") Instant generatedAt,
        @Schema(description = "Data provider") String source,
        @Schema(description = "Whether regional thresholds were applied") boolean dynamicThresholdsApplied,
        @Schema(description = "Regional P20 used as clean threshold") Double cleanThreshold,
        @Schema(description = "Regional mean intensity") Double regionalMean) {

    public static GreenHoursForecastDTO filtered(GreenHoursForecast forecast, RegionPattern pattern) {
        return new GreenHoursForecastDTO(
                forecast.region(),
                forecast.greenHours(),
                forecast.bestWindow(),
                forecast.periodStart(),
                forecast.periodEnd(),
                forecast.generatedAt(),
                forecast.source(),
                true,
                pattern.p20(),
                pattern.mean());
    }

    public static GreenHoursForecastDTO unfiltered(GreenHoursForecast forecast) {
        return new GreenHoursForecastDTO(
                forecast.region(),
                forecast.greenHours(),
                forecast.bestWindow(),
                forecast.periodStart(),
                forecast.periodEnd(),
                forecast.generatedAt(),
                forecast.source(),
                false,
                null,
                null);
    }
}
