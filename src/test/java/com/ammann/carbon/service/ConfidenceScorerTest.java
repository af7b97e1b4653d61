/* (C)2026 */
package com.ammann.carbon.service;

import static com.ammann.carbon.support.TestDataFactory.constantSamples;
import static com.ammann.carbon.support.TestDataFactory.pattern;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.carbon.model.HistoricalSample;
import com.ammann.carbon.model.RegionPattern;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConfidenceScorerTest {

    private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    /** {@code count} hourly samples, the newest {@code ageHours} before {@link #NOW}. */
    private static List<HistoricalSample> samplesEndingBefore(int count, long ageHours) {
        Instant newest = NOW.minus(Duration.ofHours(ageHours));
        return constantSamples(newest.minus(Duration.ofHours(count - 1L)), count, 200.0);
    }

    @Test
    void completeFreshUniformDataScoresOne() {
        RegionPattern pattern = pattern("DE", NOW, samplesEndingBefore(720, 0), 200.0, 0.0, 200.0, 200.0);

        assertThat(scorer.confidence(pattern, NOW)).isEqualTo(1.0);
    }

    @Test
    void partialHistoryScalesLinearlyAndRounds() {
        RegionPattern half = pattern("DE", NOW, samplesEndingBefore(360, 0), 200.0, 0.0, 200.0, 200.0);
        RegionPattern week = pattern("DE", NOW, samplesEndingBefore(168, 0), 200.0, 0.0, 200.0, 200.0);

        assertThat(scorer.confidence(half, NOW)).isEqualTo(0.5);
        assertThat(scorer.confidence(week, NOW)).isEqualTo(0.23);
    }

    @Test
    void missingPatternOrSamplesScoresZero() {
        assertThat(scorer.confidence(null, NOW)).isZero();
        assertThat(scorer.confidence(pattern("DE", NOW, 200.0, 10.0, 190.0, 210.0), NOW)).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "0, 1.0",
        "24, 1.0",
        "48, 0.7142857142857143",
        "84, 0.5",
        "500, 0.5"
    })
    void recencyDecaysAfterOneDay(long ageHours, double expected) {
        double factor = ConfidenceScorer.recencyFactor(NOW.minus(Duration.ofHours(ageHours)), NOW);

        assertThat(factor).isCloseTo(expected, within(1e-9));
    }

    @ParameterizedTest
    @CsvSource({
        "200, 0, 1.0",
        "200, 100, 0.75",
        "200, 400, 0.5",
        "0, 50, 1.0",
        "-10, 50, 1.0"
    })
    void variationFactorFollowsCoefficientOfVariation(double mean, double stdDev, double expected) {
        assertThat(ConfidenceScorer.variationFactor(mean, stdDev)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void higherVariationNeverRaisesConfidence() {
        List<HistoricalSample> samples = samplesEndingBefore(720, 0);
        double previous = Double.MAX_VALUE;

        for (double stdDev = 0; stdDev <= 180; stdDev += 20) {
            double score = scorer.confidence(pattern("DE", NOW, samples, 200.0, stdDev, 150.0, 250.0), NOW);
            assertThat(score).isLessThan(previous).isBetween(0.0, 1.0);
            previous = score;
        }
    }

    @Test
    void confidenceStaysInUnitInterval() {
        RegionPattern stale = pattern("DE", NOW, samplesEndingBefore(5000, 1000), 10.0, 1000.0, 1.0, 30.0);

        assertThat(scorer.confidence(stale, NOW)).isBetween(0.0, 1.0).isEqualTo(0.25);
    }

    @Test
    void defaultReferenceTimeComesFromClock() {
        scorer.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        RegionPattern pattern = pattern("DE", NOW, samplesEndingBefore(720, 48), 200.0, 0.0, 200.0, 200.0);

        assertThat(scorer.confidence(pattern)).isEqualTo(0.71);
    }
}
