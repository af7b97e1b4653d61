/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.model.RegionPattern;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Scores the reliability of a {@link RegionPattern} in [0, 1].
 *
 * <p>The score is the product of three factors, each clamped to [0, 1], rounded to two decimals:
 * <ul>
 *   <li><b>data completeness:</b> {@code min(n / (retentionDays * 24), 1)}</li>
 *   <li><b>recency:</b> 1 while the newest sample is at most 24 hours old, then a linear decay
 *       over one week floored at 0.5</li>
 *   <li><b>variation:</b> {@code max(0.5, 1 - cv / 2)} with cv the coefficient of variation,
 *       1 when the mean is not positive</li>
 * </ul>
 */
@ApplicationScoped
public class ConfidenceScorer {

    static final double FRESH_DATA_HOURS = 24.0;
    static final double RECENCY_DECAY_HOURS = 168.0;
    static final double MIN_FACTOR = 0.5;

    @Inject IntelligenceSettings settings = IntelligenceSettings.defaults();

    Clock clock = Clock.systemUTC();

    public double confidence(RegionPattern pattern) {
        return confidence(pattern, clock.instant());
    }

    /**
     * Scores {@code pattern} as seen at {@code now}.
     *
     * @return confidence in [0, 1]; 0 for a missing pattern or one without samples
     */
    public double confidence(RegionPattern pattern, Instant now) {
        if (pattern == null || pattern.sampleCount() == 0) {
            return 0.0;
        }

        double confidence =
                dataCompleteness(pattern)
                        * recencyFactor(pattern.newestSampleTime(), now)
                        * variationFactor(pattern.mean(), pattern.stdDev());
        return Math.round(confidence * 100.0) / 100.0;
    }

    double dataCompleteness(RegionPattern pattern) {
        double expected = settings.expectedSampleCount();
        return clamp(pattern.sampleCount() / expected);
    }

    static double recencyFactor(Instant newestSample, Instant now) {
        double hoursSinceNewest = Duration.between(newestSample, now).toMillis() / 3_600_000.0;
        if (hoursSinceNewest <= FRESH_DATA_HOURS) {
            return 1.0;
        }
        return clamp(Math.max(MIN_FACTOR, 1.0 - hoursSinceNewest / RECENCY_DECAY_HOURS));
    }

    static double variationFactor(double mean, double stdDev) {
        if (mean <= 0) {
            return 1.0;
        }
        double coefficientOfVariation = stdDev / mean;
        return clamp(Math.max(MIN_FACTOR, 1.0 - coefficientOfVariation / 2.0));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
