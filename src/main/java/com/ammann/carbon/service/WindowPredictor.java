/* (C)2026 */
package com.ammann.carbon.service;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.model.OptimalWindow;
import com.ammann.carbon.model.RegionPattern;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Forecasts the next one-hour low-carbon window from a pattern's hourly profile.
 *
 * <p>The 24 hourly averages are scanned starting at the hour after {@code from}, wrapping
 * around to {@code from}'s own hour. The first hour with the lowest average wins, which makes
 * ties resolve to the nearest future hour.
 */
@ApplicationScoped
public class WindowPredictor {

    static final String NIGHT_WIND = "Night wind patterns";
    static final String SOLAR_PEAK = "Solar generation peak";
    static final String HISTORICAL_LOW = "Historical low-carbon period";

    private static final Duration WINDOW_LENGTH = Duration.ofHours(1);

    @Inject ConfidenceScorer confidenceScorer = new ConfidenceScorer();

    @Inject IntelligenceSettings settings = IntelligenceSettings.defaults();

    /**
     * Predicts the next optimal window after {@code from}.
     *
     * @param pattern regional pattern, may be {@code null}
     * @param from    reference time; the returned window starts strictly after it
     * @return the window, or empty when there is no hourly profile
     */
    public Optional<OptimalWindow> predictNextWindow(RegionPattern pattern, Instant from) {
        if (pattern == null || pattern.hourlyAverages().isEmpty()) {
            return Optional.empty();
        }

        ZonedDateTime localFrom = from.atZone(settings.zone());
        int currentHour = localFrom.getHour();
        int bestHour = currentHour;
        double lowest = Double.MAX_VALUE;

        for (int offset = 1; offset <= RegionPattern.HOURS_PER_DAY; offset++) {
            int hour = (currentHour + offset) % RegionPattern.HOURS_PER_DAY;
            double average = pattern.hourlyAverage(hour);
            if (average < lowest) {
                lowest = average;
                bestHour = hour;
            }
        }

        Instant start = nextOccurrence(localFrom, bestHour);
        return Optional.of(
                new OptimalWindow(
                        start,
                        start.plus(WINDOW_LENGTH),
                        lowest,
                        confidenceScorer.confidence(pattern, from),
                        reasonFor(bestHour)));
    }

    /**
     * Start of {@code hour} on the calendar day of {@code from}, pushed one day ahead unless it
     * lies strictly after {@code from}.
     */
    static Instant nextOccurrence(ZonedDateTime from, int hour) {
        ZonedDateTime candidate = from.truncatedTo(ChronoUnit.HOURS).withHour(hour);
        if (!candidate.isAfter(from)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    static String reasonFor(int hour) {
        if (hour >= 22 || hour <= 6) {
            return NIGHT_WIND;
        }
        if (hour >= 10 && hour <= 16) {
            return SOLAR_PEAK;
        }
        return HISTORICAL_LOW;
    }
}
