/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.enumeration.RelativeMode;
import com.ammann.carbon.model.HistoricalSample;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.model.RelativeClassification;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Classifies a live reading against a stored {@link RegionPattern}.
 *
 * <p>The percentile reported here counts the retained samples strictly below the value. This is
 * not the nearest-rank estimator {@link PatternCalculator} uses for P20/P80, so a value equal to
 * P20 can report a percentile other than 20.
 */
@ApplicationScoped
public class RelativeMetricsEngine {

    static final double MEDIAN_PERCENTILE = 50.0;
    static final double CLEAN_RANK_LIMIT = 20.0;
    static final double DIRTY_RANK_LIMIT = 80.0;
    static final String AVERAGE_RANK = "average for this region";

    public RelativeClassification classify(double value, RegionPattern pattern) {
        double percentile = percentile(value, pattern);
        return new RelativeClassification(
                percentile,
                RelativeMode.classify(value, pattern.p20(), pattern.p80()),
                dailyRank(percentile),
                trendMagnitude(value, pattern.mean()));
    }

    /**
     * Percentage of retained samples strictly below {@code value}, rounded to one decimal.
     * A pattern without samples yields the median, 50.
     */
    public double percentile(double value, RegionPattern pattern) {
        int total = pattern.sampleCount();
        if (total == 0) {
            return MEDIAN_PERCENTILE;
        }

        int below = 0;
        for (HistoricalSample sample : pattern.samples()) {
            if (sample.carbonIntensity() < value) {
                below++;
            }
        }

        double percentile = (double) below / total * 100.0;
        return Math.round(percentile * 10.0) / 10.0;
    }

    static String dailyRank(double percentile) {
        if (percentile <= CLEAN_RANK_LIMIT) {
            return String.format("top %d%% cleanest", (int) percentile);
        }
        if (percentile >= DIRTY_RANK_LIMIT) {
            return String.format("top %d%% dirtiest", (int) (100 - percentile));
        }
        return AVERAGE_RANK;
    }

    static double trendMagnitude(double value, double mean) {
        if (mean <= 0) {
            return 0.0;
        }
        return (value - mean) / mean * 100.0;
    }
}
