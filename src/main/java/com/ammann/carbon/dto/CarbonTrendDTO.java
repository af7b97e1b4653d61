/* (C)2026 */
package com.ammann.carbon.dto;

import com.ammann.carbon.enumeration.TrendPeriod;
import com.ammann.carbon.model.HistoricalSample;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Historical carbon-intensity trend report for one location.
 *
 * <p>{@code cleanestHours} and {@code dirtiestHours} hold three hours each, ordered from the
 * most extreme, and are empty when fewer than three distinct hours were observed.
 */
@Schema(description = "Historical carbon intensity trend for a location")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CarbonTrendDTO(
        @Schema(description = "Requested location") String location,
        @Schema(description = "Reporting period") TrendPeriod period,
        @Schema(description = "Start of the analysed window") Instant startDate,
        @Schema(description = "End of the analysed window") Instant endDate,
        @Schema(description = "Number of samples analysed") Integer sampleCount,
        @Schema(description = "Mean intensity in g CO2/kWh") Double averageIntensity,
        @Schema(description = "Lowest intensity in g CO2/kWh") Double minIntensity,
        @Schema(description = "Highest intensity in g CO2/kWh") Double maxIntensity,
        @Schema(description = "Population standard deviation in g CO2/kWh") Double stdDeviation,
        @Schema(description = "Hours of day with the lowest average intensity") List<Integer> cleanestHours,
        @Schema(description = "Hours of day with the highest average intensity") List<Integer> dirtiestHours,
        @Schema(description = "Average intensity keyed weekday_average / weekend_average")
                Map<String, Double> weekdayVsWeekend,
        @Schema(description = "Raw samples, only for short daily reports") List<HistoricalSample> dataPoints) {}
