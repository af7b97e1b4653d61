/* (C)2026 */
package com.ammann.carbon.config;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of the {@code carbon.intelligence.*} configuration.
 *
 * <p>Produced once by {@link IntelligenceSettingsProducer}; unit tests build instances directly
 * through {@link #defaults()} and the {@code with*} copies.
 *
 * @param historyRetentionDays     days of history fetched per pattern computation
 * @param minDataPointsForAnalysis minimum sample count for a pattern or trend report
 * @param updateInterval           age after which a cached pattern is stale, also the sweep period
 * @param highVariationRegions     static allow-list behind the {@code highVariation} flag
 * @param zone                     zone used to derive hour-of-day and weekday from timestamps
 * @param readTimeout              default wait of a read for an in-flight recomputation
 * @param regionRefreshTimeout     bound on a single region refresh during a scheduled sweep
 */
public record IntelligenceSettings(
        int historyRetentionDays,
        int minDataPointsForAnalysis,
        Duration updateInterval,
        Set<String> highVariationRegions,
        ZoneId zone,
        Duration readTimeout,
        Duration regionRefreshTimeout) {

    public static final int DEFAULT_HISTORY_RETENTION_DAYS = 30;
    public static final int DEFAULT_MIN_DATA_POINTS = 168; // one week of hourly samples
    public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofMinutes(15);
    public static final List<String> DEFAULT_HIGH_VARIATION_REGIONS =
            List.of("PL", "US-TEX", "CN", "IN", "AU-NSW", "ZA");

    public IntelligenceSettings {
        if (historyRetentionDays <= 0) {
            throw new IllegalArgumentException("historyRetentionDays must be positive");
        }
        if (minDataPointsForAnalysis <= 0) {
            throw new IllegalArgumentException("minDataPointsForAnalysis must be positive");
        }
        Objects.requireNonNull(updateInterval, "updateInterval");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(regionRefreshTimeout, "regionRefreshTimeout");
        highVariationRegions = highVariationRegions == null ? Set.of() : Set.copyOf(highVariationRegions);
    }

    public static IntelligenceSettings defaults() {
        return new IntelligenceSettings(
                DEFAULT_HISTORY_RETENTION_DAYS,
                DEFAULT_MIN_DATA_POINTS,
                DEFAULT_UPDATE_INTERVAL,
                Set.copyOf(DEFAULT_HIGH_VARIATION_REGIONS),
                ZoneOffset.UTC,
                Duration.ofSeconds(10),
                Duration.ofMinutes(5));
    }

    /** Number of hourly samples a full retention window holds. */
    public int expectedSampleCount() {
        return historyRetentionDays * 24;
    }

    public boolean isHighVariationRegion(String region) {
        return region != null && highVariationRegions.contains(region);
    }

    public IntelligenceSettings withMinDataPoints(int minDataPoints) {
        return new IntelligenceSettings(historyRetentionDays, minDataPoints, updateInterval,
                highVariationRegions, zone, readTimeout, regionRefreshTimeout);
    }

    public IntelligenceSettings withHistoryRetentionDays(int days) {
        return new IntelligenceSettings(days, minDataPointsForAnalysis, updateInterval,
                highVariationRegions, zone, readTimeout, regionRefreshTimeout);
    }

    public IntelligenceSettings withUpdateInterval(Duration interval) {
        return new IntelligenceSettings(historyRetentionDays, minDataPointsForAnalysis, interval,
                highVariationRegions, zone, readTimeout, regionRefreshTimeout);
    }

    public IntelligenceSettings withReadTimeout(Duration timeout) {
        return new IntelligenceSettings(historyRetentionDays, minDataPointsForAnalysis, updateInterval,
                highVariationRegions, zone, timeout, regionRefreshTimeout);
    }

    public IntelligenceSettings withRegionRefreshTimeout(Duration timeout) {
        return new IntelligenceSettings(historyRetentionDays, minDataPointsForAnalysis, updateInterval,
                highVariationRegions, zone, readTimeout, timeout);
    }
}
