/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.enumeration.TrendDirection;
import com.ammann.carbon.exception.InsufficientDataException;
import com.ammann.carbon.model.HistoricalSample;
import com.ammann.carbon.model.RegionPattern;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns an ordered set of historical samples into a {@link RegionPattern}.
 *
 * <p>Computes:
 * <ul>
 *   <li>population mean and standard deviation</li>
 *   <li>P20/P80 thresholds with the nearest-rank rule {@code sorted[floor(n * k / 100)]},
 *       no interpolation</li>
 *   <li>average intensity per hour of day, falling back to the global mean for hours
 *       without samples</li>
 *   <li>trend direction and trend confidence via {@link TrendAnalyzer}</li>
 * </ul>
 *
 * <p>The thresholds are deliberately a different estimator than the counting percentile of
 * {@link RelativeMetricsEngine}; the two do not necessarily agree for the same value.
 *
 * <p>Stateless apart from configuration; the only wall-clock dependency is the
 * {@code lastUpdated} stamp, which callers can pass explicitly.
 */
@ApplicationScoped
public class PatternCalculator
{

    private static final Logger LOG = Logger.getLogger(PatternCalculator.class);

    static final int CLEAN_PERCENTILE = 20;
    static final int DIRTY_PERCENTILE = 80;

    @Inject
    TrendAnalyzer trendAnalyzer = new TrendAnalyzer();

    @Inject
    IntelligenceSettings settings = IntelligenceSettings.defaults();

    /**
     * Computes a pattern stamped with the current time.
     *
     * @see #computePattern(String, List, int, Instant)
     */
    public RegionPattern computePattern(String region, List<HistoricalSample> samples, int minPoints)
    {
        return computePattern(region, samples, minPoints, Instant.now());
    }

    /**
     * Computes the statistical summary of {@code samples}.
     *
     * @param region     region identifier stored in the pattern
     * @param samples    samples in ascending timestamp order; not re-sorted
     * @param minPoints  minimum number of samples required
     * @param computedAt value for {@link RegionPattern#lastUpdated()}
     * @return the new pattern
     * @throws InsufficientDataException if fewer than {@code minPoints} samples are supplied
     * @throws IllegalArgumentException  if {@code minPoints} is not positive
     */
    public RegionPattern computePattern(
            String region, List<HistoricalSample> samples, int minPoints, Instant computedAt)
    {
        if (minPoints <= 0) {
            throw new IllegalArgumentException("minPoints must be positive but was " + minPoints);
        }

        int count = samples == null ? 0 : samples.size();
        if (count < minPoints) {
            throw new InsufficientDataException(count, minPoints);
        }

        double[] intensities = new double[count];
        for (int i = 0; i < count; i++) {
            intensities[i] = samples.get(i).carbonIntensity();
        }

        double mean = mean(intensities);
        double stdDev = populationStdDev(intensities, mean);

        double[] sorted = intensities.clone();
        Arrays.sort(sorted);
        double p20 = nearestRankPercentile(sorted, CLEAN_PERCENTILE);
        double p80 = nearestRankPercentile(sorted, DIRTY_PERCENTILE);

        List<Double> hourlyAverages = hourlyAverages(samples, mean, settings.zone());
        TrendDirection trendDirection = trendAnalyzer.trendDirection(samples);
        double trendConfidence = trendAnalyzer.trendConfidence(samples, minPoints);

        LOG.debugf("Computed pattern for %s from %d samples: mean=%.2f stddev=%.2f p20=%.2f p80=%.2f trend=%s",
                region, count, mean, stdDev, p20, p80, trendDirection);

        return new RegionPattern(
                region,
                computedAt,
                samples,
                mean,
                stdDev,
                p20,
                p80,
                hourlyAverages,
                trendDirection,
                trendConfidence);
    }

    /**
     * Nearest-rank percentile over ascending {@code sorted} values: {@code sorted[floor(n * k / 100)]}.
     */
    static double nearestRankPercentile(double[] sorted, int percentile)
    {
        int index = (int) ((long) sorted.length * percentile / 100);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    static double mean(double[] values)
    {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    static double populationStdDev(double[] values, double mean)
    {
        double varianceSum = 0.0;
        for (double value : values) {
            double diff = value - mean;
            varianceSum += diff * diff;
        }
        return Math.sqrt(varianceSum / values.length);
    }

    /**
     * Averages intensities per hour of day in {@code zone}. Hours without samples take
     * {@code fallback}; neighbouring hours are not interpolated.
     */
    static List<Double> hourlyAverages(List<HistoricalSample> samples, double fallback, ZoneId zone)
    {
        double[] sums = new double[RegionPattern.HOURS_PER_DAY];
        int[] counts = new int[RegionPattern.HOURS_PER_DAY];

        for (HistoricalSample sample : samples) {
            int hour = sample.timestamp().atZone(zone).getHour();
            sums[hour] += sample.carbonIntensity();
            counts[hour]++;
        }

        List<Double> averages = new ArrayList<>(RegionPattern.HOURS_PER_DAY);
        for (int hour = 0; hour < RegionPattern.HOURS_PER_DAY; hour++) {
            averages.add(counts[hour] > 0 ? sums[hour] / counts[hour] : fallback);
        }
        return averages;
    }
}
