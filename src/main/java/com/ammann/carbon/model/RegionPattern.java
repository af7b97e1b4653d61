/* (C)2026 */
package com.ammann.carbon.model;

import com.ammann.carbon.enumeration.TrendDirection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Learned statistical model of carbon intensity for one region.
 *
 * <p>Instances are immutable. A refresh produces a new instance that replaces the cached one
 * wholesale, so readers holding a reference never observe a partial update.
 *
 * <p>{@code p20 <= mean <= p80} holds for ordinary inputs but is not enforced: the thresholds are
 * taken from the sorted sample values independently of the mean, and skewed or tied inputs can
 * break the ordering.
 *
 * @param region          region identifier
 * @param lastUpdated     time the pattern was computed
 * @param samples         samples the pattern was computed from, in ascending time order
 * @param mean            population mean intensity
 * @param stdDev          population standard deviation
 * @param p20             nearest-rank 20th percentile, the "clean" threshold
 * @param p80             nearest-rank 80th percentile, the "dirty" threshold
 * @param hourlyAverages  average intensity per hour of day, exactly 24 entries
 * @param trendDirection  direction of the least-squares trend over the samples
 * @param trendConfidence confidence in the trend, capped at 0.8
 */
public record RegionPattern(
        String region,
        Instant lastUpdated,
        List<HistoricalSample> samples,
        double mean,
        double stdDev,
        double p20,
        double p80,
        List<Double> hourlyAverages,
        TrendDirection trendDirection,
        double trendConfidence) {

    public static final int HOURS_PER_DAY = 24;

    public RegionPattern {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        Objects.requireNonNull(trendDirection, "trendDirection");
        samples = samples == null ? List.of() : List.copyOf(samples);
        hourlyAverages = List.copyOf(Objects.requireNonNull(hourlyAverages, "hourlyAverages"));
        if (hourlyAverages.size() != HOURS_PER_DAY) {
            throw new IllegalArgumentException(
                    "hourlyAverages must have 24 entries but had " + hourlyAverages.size());
        }
    }

    public int sampleCount() {
        return samples.size();
    }

    public double hourlyAverage(int hour) {
        return hourlyAverages.get(hour);
    }

    /**
     * Returns the timestamp of the newest retained sample, or {@code null} without samples.
     */
    public Instant newestSampleTime() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1).timestamp();
    }
}
