/* (C)2026 */
package com.ammann.carbon.resource;

import com.ammann.carbon.dto.CarbonTrendDTO;
import com.ammann.carbon.dto.GreenHoursForecastDTO;
import com.ammann.carbon.dto.PatternEvictionResponseDTO;
import com.ammann.carbon.dto.PatternSummaryDTO;
import com.ammann.carbon.dto.RegionalStrategyDTO;
import com.ammann.carbon.dto.RelativeCarbonIntensityDTO;
import com.ammann.carbon.enumeration.TrendPeriod;
import com.ammann.carbon.exception.ValidationException;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.properties.ApiProperties;
import com.ammann.carbon.service.CarbonIntelligenceService;
import com.ammann.carbon.service.ConfidenceScorer;
import com.ammann.carbon.service.RegionalStrategyCatalog;
import com.ammann.carbon.store.RegionPatternStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for regional carbon-intensity analytics.
 *
 * <p>Provides endpoints for the current intensity relative to a region's history, green hours
 * filtered by learned thresholds, historical trend reports and static regional strategies, plus
 * inspection and eviction of the cached region patterns.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Carbon Intelligence API", description = "Regional carbon intensity patterns and analytics")
@Produces(MediaType.APPLICATION_JSON)
public class CarbonIntelligenceResource {

    private static final Logger LOG = Logger.getLogger(CarbonIntelligenceResource.class);

    static final int MAX_FORECAST_HOURS = 168;
    static final int MAX_TREND_DAYS = 365;

    @Inject CarbonIntelligenceService intelligenceService;

    @Inject RegionalStrategyCatalog strategyCatalog;

    @Inject RegionPatternStore patternStore;

    @Inject ConfidenceScorer confidenceScorer;

    @GET
    @Path(ApiProperties.Carbon.RELATIVE)
    @Operation(
            summary = "Get Relative Carbon Intensity",
            description =
                    "Returns the current carbon intensity of a region together with its percentile,"
                            + " classification and trend relative to the region's own history.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Relative intensity computed",
                content = @Content(schema = @Schema(implementation = RelativeCarbonIntensityDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid region"),
        @APIResponse(responseCode = "502", description = "Carbon data provider unavailable")
    })
    public Response getRelativeIntensity(
            @Parameter(description = "Grid zone or location, e.g. DE or Berlin")
                    @PathParam(ApiProperties.REGION_PARAM)
                    String region) {

        String validRegion = requireRegion(region);
        LOG.debugf("Relative intensity request: region=%s", validRegion);

        return Response.ok(intelligenceService.getRelativeCarbonIntensity(validRegion)).build();
    }

    @GET
    @Path(ApiProperties.Carbon.GREEN_HOURS)
    @Operation(
            summary = "Get Dynamic Green Hours",
            description =
                    "Returns forecast green hours filtered by the region's learned thresholds. Falls"
                            + " back to the unfiltered forecast when no pattern is available.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Green hours forecast",
                content = @Content(schema = @Schema(implementation = GreenHoursForecastDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "502", description = "Carbon data provider unavailable")
    })
    public Response getGreenHours(
            @Parameter(description = "Grid zone or location") @PathParam(ApiProperties.REGION_PARAM)
                    String region,
            @Parameter(description = "Forecast horizon in hours (1-168)")
                    @QueryParam("hours")
                    @DefaultValue("24")
                    int hours) {

        String validRegion = requireRegion(region);
        if (hours <= 0 || hours > MAX_FORECAST_HOURS) {
            throw ValidationException.invalidParameter("hours", hours, "value between 1 and " + MAX_FORECAST_HOURS);
        }

        LOG.debugf("Green hours request: region=%s, hours=%d", validRegion, hours);
        return Response.ok(intelligenceService.getDynamicGreenHours(validRegion, hours)).build();
    }

    @GET
    @Path(ApiProperties.Carbon.TRENDS)
    @Operation(
            summary = "Get Carbon Trends",
            description =
                    "Returns a historical trend report with cleanest and dirtiest hours and weekday"
                            + " versus weekend averages.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Trend report",
                content = @Content(schema = @Schema(implementation = CarbonTrendDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "422", description = "Not enough historical data"),
        @APIResponse(responseCode = "502", description = "Carbon data provider unavailable")
    })
    public Response getTrends(
            @Parameter(description = "Grid zone or location") @PathParam(ApiProperties.REGION_PARAM)
                    String region,
            @Parameter(description = "Reporting period: daily, weekly or monthly")
                    @QueryParam("period")
                    @DefaultValue("daily")
                    String period,
            @Parameter(description = "Days to analyse (1-365), defaults to the period length")
                    @QueryParam("days")
                    Integer days) {

        String validRegion = requireRegion(region);

        TrendPeriod trendPeriod;
        try {
            trendPeriod = TrendPeriod.fromLabel(period);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("period", period, "one of daily, weekly, monthly");
        }

        if (days != null && (days <= 0 || days > MAX_TREND_DAYS)) {
            throw ValidationException.invalidParameter("days", days, "value between 1 and " + MAX_TREND_DAYS);
        }

        LOG.debugf("Trend request: region=%s, period=%s, days=%s", validRegion, trendPeriod.getLabel(), days);
        return Response.ok(intelligenceService.getCarbonTrends(validRegion, trendPeriod, days)).build();
    }

    @GET
    @Path(ApiProperties.Carbon.STRATEGY)
    @Operation(
            summary = "Get Regional Strategy",
            description = "Returns static optimization advice for the region's grid.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Regional strategy",
                content = @Content(schema = @Schema(implementation = RegionalStrategyDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid region")
    })
    public Response getStrategy(
            @Parameter(description = "Grid zone or location") @PathParam(ApiProperties.REGION_PARAM)
                    String region) {
        return Response.ok(strategyCatalog.strategyFor(requireRegion(region))).build();
    }

    @GET
    @Path(ApiProperties.Carbon.PATTERNS)
    @Operation(
            summary = "List Cached Patterns",
            description = "Returns a summary of every cached region pattern, ordered by region.")
    @APIResponse(
            responseCode = "200",
            description = "Cached pattern summaries",
            content = @Content(schema = @Schema(implementation = PatternSummaryDTO.class)))
    public Response listPatterns() {
        List<PatternSummaryDTO> summaries = patternStore.snapshot().values().stream()
                .sorted(Comparator.comparing(RegionPattern::region))
                .map(p -> PatternSummaryDTO.from(p, confidenceScorer.confidence(p), patternStore.isStale(p)))
                .collect(Collectors.toList());
        return Response.ok(summaries).build();
    }

    @DELETE
    @Path(ApiProperties.Carbon.PATTERNS)
    @Operation(summary = "Clear Pattern Cache", description = "Evicts every cached region pattern.")
    @APIResponse(
            responseCode = "200",
            description = "Cache cleared",
            content = @Content(schema = @Schema(implementation = PatternEvictionResponseDTO.class)))
    public Response clearPatterns() {
        int evicted = patternStore.clear();
        return Response.ok(new PatternEvictionResponseDTO(evicted, patternStore.cachedRegions())).build();
    }

    @DELETE
    @Path(ApiProperties.Carbon.PATTERN)
    @Operation(summary = "Evict Region Pattern", description = "Evicts the cached pattern of one region.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Pattern evicted",
                content = @Content(schema = @Schema(implementation = PatternEvictionResponseDTO.class))),
        @APIResponse(responseCode = "404", description = "No pattern cached for the region")
    })
    public Response evictPattern(
            @Parameter(description = "Region identifier as cached") @PathParam(ApiProperties.REGION_PARAM)
                    String region) {

        String validRegion = requireRegion(region);
        if (!patternStore.evict(validRegion)) {
            throw new NotFoundException("No cached pattern for region '" + validRegion + "'");
        }
        return Response.ok(new PatternEvictionResponseDTO(1, patternStore.cachedRegions())).build();
    }

    private static String requireRegion(String region) {
        if (region == null || region.isBlank()) {
            throw ValidationException.invalidParameter("region", region, "non-blank region or location");
        }
        return region.trim();
    }
}
