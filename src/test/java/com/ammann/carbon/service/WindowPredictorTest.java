/* (C)2026 */
package com.ammann.carbon.service;

import static com.ammann.carbon.support.TestDataFactory.MONDAY_0400;
import static com.ammann.carbon.support.TestDataFactory.patternWithHourlyAverages;
import static com.ammann.carbon.support.TestDataFactory.weekOfDailyProfile;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.carbon.config.IntelligenceSettings;
import com.ammann.carbon.model.OptimalWindow;
import com.ammann.carbon.model.RegionPattern;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class WindowPredictorTest {

    private final WindowPredictor predictor = new WindowPredictor();

    private static List<Double> flatWithDip(double base, int... dipHours) {
        List<Double> hourly = new ArrayList<>(Collections.nCopies(24, base));
        for (int hour : dipHours) {
            hourly.set(hour, base / 4);
        }
        return hourly;
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "2026-01-12T00:30:00Z",
        "2026-01-12T05:00:00Z",
        "2026-01-12T07:15:00Z",
        "2026-01-12T13:00:00Z",
        "2026-01-12T23:59:59Z"
    })
    void repeatingDailyProfilePointsToNightHours(String from) {
        PatternCalculator calculator = new PatternCalculator();
        RegionPattern pattern = calculator.computePattern(
                "DE", weekOfDailyProfile(MONDAY_0400), 168, Instant.parse("2026-01-12T04:00:00Z"));

        OptimalWindow window = predictor.predictNextWindow(pattern, Instant.parse(from)).orElseThrow();

        int hour = window.start().atZone(ZoneOffset.UTC).getHour();
        assertThat(hour).isBetween(0, 6);
        assertThat(window.reason()).isEqualTo(WindowPredictor.NIGHT_WIND);
        assertThat(window.expectedIntensity()).isEqualTo(100.0);
        assertThat(window.start()).isAfter(Instant.parse(from));
        assertThat(window.end()).isEqualTo(window.start().plus(Duration.ofHours(1)));
    }

    @Test
    void firstCheapHourAfterCurrentHourWins() {
        RegionPattern pattern = patternWithHourlyAverages("DE", MONDAY_0400, flatWithDip(200.0, 3, 20));

        OptimalWindow morning = predictor.predictNextWindow(pattern, Instant.parse("2026-01-12T10:00:00Z"))
                .orElseThrow();
        OptimalWindow evening = predictor.predictNextWindow(pattern, Instant.parse("2026-01-12T21:00:00Z"))
                .orElseThrow();

        assertThat(morning.start()).isEqualTo(Instant.parse("2026-01-12T20:00:00Z"));
        assertThat(evening.start()).isEqualTo(Instant.parse("2026-01-13T03:00:00Z"));
    }

    @Test
    void selectsArgminOfHourlyAverages() {
        List<Double> hourly = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            hourly.add(200.0 + 5.0 * Math.abs(hour - 14));
        }
        hourly.set(14, 50.0);
        RegionPattern pattern = patternWithHourlyAverages("DE", MONDAY_0400, hourly);

        OptimalWindow window = predictor.predictNextWindow(pattern, Instant.parse("2026-01-12T16:20:00Z"))
                .orElseThrow();

        assertThat(window.start()).isEqualTo(Instant.parse("2026-01-13T14:00:00Z"));
        assertThat(window.end()).isEqualTo(Instant.parse("2026-01-13T15:00:00Z"));
        assertThat(window.expectedIntensity()).isEqualTo(50.0);
        assertThat(window.reason()).isEqualTo(WindowPredictor.SOLAR_PEAK);
    }

    @Test
    void currentHourIsOnlyChosenForTomorrow() {
        RegionPattern pattern = patternWithHourlyAverages("DE", MONDAY_0400, flatWithDip(200.0, 10));

        OptimalWindow onTheHour = predictor.predictNextWindow(pattern, Instant.parse("2026-01-12T10:00:00Z"))
                .orElseThrow();
        OptimalWindow before = predictor.predictNextWindow(pattern, Instant.parse("2026-01-12T09:30:00Z"))
                .orElseThrow();

        assertThat(onTheHour.start()).isEqualTo(Instant.parse("2026-01-13T10:00:00Z"));
        assertThat(before.start()).isEqualTo(Instant.parse("2026-01-12T10:00:00Z"));
    }

    @Test
    void hoursAreInterpretedInConfiguredZone() {
        predictor.settings = new IntelligenceSettings(
                30, 168, Duration.ofMinutes(15), Set.of(), ZoneId.of("Europe/Berlin"),
                Duration.ofSeconds(10), Duration.ofMinutes(5));
        RegionPattern pattern = patternWithHourlyAverages("DE", MONDAY_0400, flatWithDip(200.0, 0));

        OptimalWindow window = predictor.predictNextWindow(pattern, Instant.parse("2026-01-12T12:00:00Z"))
                .orElseThrow();

        assertThat(window.start()).isEqualTo(Instant.parse("2026-01-12T23:00:00Z"));
        assertThat(window.reason()).isEqualTo(WindowPredictor.NIGHT_WIND);
    }

    @Test
    void confidenceComesFromScorerAtReferenceTime() {
        RegionPattern pattern = patternWithHourlyAverages("DE", MONDAY_0400, flatWithDip(200.0, 4));
        Instant from = MONDAY_0400.plus(Duration.ofDays(3));

        OptimalWindow window = predictor.predictNextWindow(pattern, from).orElseThrow();

        assertThat(window.confidence()).isEqualTo(new ConfidenceScorer().confidence(pattern, from));
    }

    @Test
    void noPatternMeansNoWindow() {
        assertThat(predictor.predictNextWindow(null, MONDAY_0400)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "0, Night wind patterns",
        "6, Night wind patterns",
        "7, Historical low-carbon period",
        "9, Historical low-carbon period",
        "10, Solar generation peak",
        "16, Solar generation peak",
        "17, Historical low-carbon period",
        "21, Historical low-carbon period",
        "22, Night wind patterns",
        "23, Night wind patterns"
    })
    void reasonDependsOnHour(int hour, String reason) {
        assertThat(WindowPredictor.reasonFor(hour)).isEqualTo(reason);
    }
}
