/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.dto.CarbonTrendDTO;
import com.ammann.carbon.dto.GreenHoursForecastDTO;
import com.ammann.carbon.dto.RelativeCarbonIntensityDTO;
import com.ammann.carbon.enumeration.TrendPeriod;
import com.ammann.carbon.exception.InsufficientDataException;
import com.ammann.carbon.exception.NoPatternAvailableException;
import com.ammann.carbon.model.CurrentIntensity;
import com.ammann.carbon.model.GreenHour;
import com.ammann.carbon.model.GreenHoursForecast;
import com.ammann.carbon.model.HistoricalSample;
import com.ammann.carbon.model.OptimalWindow;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.model.RelativeClassification;
import com.ammann.carbon.source.CarbonDataSource;
import com.ammann.carbon.store.RegionPatternStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Entry point for carbon-intensity analytics.
 * <p>
 * Combines live readings from the {@link CarbonDataSource} with the learned
 * {@link RegionPattern} of a region. Pattern problems never fail a request on their own:
 * <ul>
 *   <li>relative intensity degrades to the absolute reading with confidence 0.5</li>
 *   <li>green hours fall back to the unfiltered provider forecast</li>
 * </ul>
 * Failures of the live reading or the forecast itself propagate.
 */
@ApplicationScoped
public class CarbonIntelligenceService {

    private static final Logger LOG = Logger.getLogger(CarbonIntelligenceService.class);

    /** Standard deviation in g CO2/kWh above which hours below the mean also count as green. */
    static final double HIGH_VARIATION_STDDEV = 50.0;

    /** Confidence multiplier for hours admitted through the below-mean rule. */
    static final double BELOW_MEAN_CONFIDENCE_FACTOR = 0.8;

    @Inject CarbonDataSource dataSource;

    @Inject RegionPatternStore patternStore;

    @Inject RelativeMetricsEngine metricsEngine;

    @Inject WindowPredictor windowPredictor;

    @Inject ConfidenceScorer confidenceScorer;

    @Inject TrendAnalyzer trendAnalyzer;

    @Inject IntelligenceSettings settings;

    Clock clock = Clock.systemUTC();

    public RelativeCarbonIntensityDTO getRelativeCarbonIntensity(String region) {
        return getRelativeCarbonIntensity(region, settings.readTimeout());
    }

    /**
     * Returns the current intensity of {@code region} with metrics relative to its own history.
     *
     * @param region  region identifier
     * @param timeout maximum wait for a pattern recomputation
     * @return the relative view, or the absolute reading alone when no pattern is available
     */
    public RelativeCarbonIntensityDTO getRelativeCarbonIntensity(String region, Duration timeout) {
        CurrentIntensity current = dataSource.fetchCurrentIntensity(region);
        boolean highVariation = isHighVariationRegion(region);

        RegionPattern pattern;
        try {
            pattern = patternStore.getPattern(region, timeout);
        } catch (NoPatternAvailableException e) {
            LOG.warnf("No pattern for %s, returning absolute values only: %s", region, e.getMessage());
            return RelativeCarbonIntensityDTO.degraded(current, highVariation);
        }

        Instant now = clock.instant();
        RelativeClassification classification = metricsEngine.classify(current.carbonIntensity(), pattern);
        OptimalWindow window = windowPredictor.predictNextWindow(pattern, now).orElse(null);
        double confidence = confidenceScorer.confidence(pattern, now);

        LOG.debugf("Relative intensity for %s: %.1f g CO2/kWh, percentile %.1f, mode %s",
                region, current.carbonIntensity(), classification.percentile(), classification.mode());

        return RelativeCarbonIntensityDTO.of(current, pattern, classification, window, confidence, highVariation);
    }

    public GreenHoursForecastDTO getDynamicGreenHours(String region, int hours) {
        return getDynamicGreenHours(region, hours, settings.readTimeout());
    }

    /**
     * Returns the provider's green hours for the next {@code hours} hours, filtered by the
     * region's own thresholds when a pattern is available.
     */
    public GreenHoursForecastDTO getDynamicGreenHours(String region, int hours, Duration timeout) {
        RegionPattern pattern;
        try {
            pattern = patternStore.getPattern(region, timeout);
        } catch (NoPatternAvailableException e) {
            LOG.warnf("No pattern for %s, returning unfiltered forecast: %s", region, e.getMessage());
            return GreenHoursForecastDTO.unfiltered(dataSource.fetchGreenHoursForecast(region, hours));
        }

        GreenHoursForecast forecast = dataSource.fetchGreenHoursForecast(region, hours);
        List<GreenHour> filtered = applyDynamicThresholds(forecast.greenHours(), pattern);

        LOG.debugf("Dynamic thresholds kept %d of %d forecast hours for %s",
                filtered.size(), forecast.greenHours().size(), region);

        return GreenHoursForecastDTO.filtered(forecast.withGreenHours(filtered), pattern);
    }

    /**
     * Keeps the hours that are clean for this region: intensity at or below P20, or, in regions
     * whose standard deviation exceeds {@value #HIGH_VARIATION_STDDEV}, below the mean. Hours
     * admitted by the second rule carry 80% of their original confidence. Order is preserved.
     */
    public static List<GreenHour> applyDynamicThresholds(List<GreenHour> hours, RegionPattern pattern) {
        List<GreenHour> result = new ArrayList<>();
        if (hours == null) {
            return result;
        }

        boolean highVariation = pattern.stdDev() > HIGH_VARIATION_STDDEV;
        for (GreenHour hour : hours) {
            if (hour.carbonIntensity() <= pattern.p20()) {
                result.add(hour);
            } else if (highVariation && hour.carbonIntensity() < pattern.mean()) {
                result.add(hour.withConfidenceScaledBy(BELOW_MEAN_CONFIDENCE_FACTOR));
            }
        }
        return result;
    }

    /**
     * Builds a trend report over the last {@code days} days, or the period's default span when
     * {@code days} is {@code null}.
     *
     * @throws InsufficientDataException if fewer than {@code minDataPointsForAnalysis} samples exist
     */
    public CarbonTrendDTO getCarbonTrends(String region, TrendPeriod period, Integer days) {
        int span = days != null ? days : period.getDefaultDays();
        if (span <= 0) {
            throw new IllegalArgumentException("days must be positive but was " + span);
        }

        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(span));
        List<HistoricalSample> samples = dataSource.fetchHistoricalSamples(region, start, end);

        if (samples.size() < settings.minDataPointsForAnalysis()) {
            throw new InsufficientDataException(samples.size(), settings.minDataPointsForAnalysis());
        }

        LOG.debugf("Building %s trend report for %s from %d samples", period.getLabel(), region, samples.size());
        return trendAnalyzer.buildTrendReport(region, period, samples, start, end, settings.zone());
    }

    public boolean isHighVariationRegion(String region) {
        return settings.isHighVariationRegion(region);
    }
}
