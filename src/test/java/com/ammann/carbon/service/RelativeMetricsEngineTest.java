/* (C)2026 */
package com.ammann.carbon.service;

import static com.ammann.carbon.support.TestDataFactory.MONDAY_0400;
import static com.ammann.carbon.support.TestDataFactory.hourlySamples;
import static com.ammann.carbon.support.TestDataFactory.pattern;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.carbon.enumeration.RelativeMode;
import com.ammann.carbon.model.RegionPattern;
import com.ammann.carbon.model.RelativeClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RelativeMetricsEngineTest {

    private final RelativeMetricsEngine engine = new RelativeMetricsEngine();

    /** Samples 10, 20, ..., 100; mean 55, P20 30, P80 90. */
    private final RegionPattern tenSteps =
            pattern("DE", MONDAY_0400, hourlySamples(MONDAY_0400, 10, i -> 10.0 * (i + 1)), 55.0, 28.7, 30.0, 90.0);

    @ParameterizedTest
    @CsvSource({
        "5, 0.0",
        "10, 0.0",
        "10.5, 10.0",
        "55, 50.0",
        "100, 90.0",
        "1000, 100.0"
    })
    void percentileCountsSamplesStrictlyBelow(double value, double expected) {
        assertThat(engine.percentile(value, tenSteps)).isEqualTo(expected);
    }

    @Test
    void percentileIsRoundedToOneDecimal() {
        RegionPattern three = pattern("DE", MONDAY_0400, hourlySamples(MONDAY_0400, 3, i -> 100.0 * (i + 1)),
                200.0, 81.6, 100.0, 300.0);

        assertThat(engine.percentile(150.0, three)).isEqualTo(33.3);
        assertThat(engine.percentile(250.0, three)).isEqualTo(66.7);
    }

    @Test
    void percentileIsMonotoneInValue() {
        double previous = -1.0;
        for (double value = 0; value <= 120; value += 2.5) {
            double percentile = engine.percentile(value, tenSteps);
            assertThat(percentile).isGreaterThanOrEqualTo(previous);
            previous = percentile;
        }
    }

    @Test
    void patternWithoutSamplesIsMedian() {
        RegionPattern empty = pattern("DE", MONDAY_0400, 200.0, 20.0, 180.0, 220.0);

        assertThat(engine.percentile(1.0, empty)).isEqualTo(50.0);
        assertThat(engine.classify(1.0, empty).dailyRank()).isEqualTo(RelativeMetricsEngine.AVERAGE_RANK);
    }

    @ParameterizedTest
    @CsvSource({
        "0.0, top 0% cleanest",
        "15.4, top 15% cleanest",
        "20.0, top 20% cleanest",
        "20.1, average for this region",
        "79.9, average for this region",
        "80.0, top 20% dirtiest",
        "92.5, top 7% dirtiest",
        "100.0, top 0% dirtiest"
    })
    void dailyRankDescribesPercentile(double percentile, String expected) {
        assertThat(RelativeMetricsEngine.dailyRank(percentile)).isEqualTo(expected);
    }

    @Test
    void classifiesAgainstRegionalThresholds() {
        RelativeClassification clean = engine.classify(30.0, tenSteps);
        RelativeClassification average = engine.classify(60.0, tenSteps);
        RelativeClassification dirty = engine.classify(90.0, tenSteps);

        assertThat(clean.mode()).isEqualTo(RelativeMode.CLEAN);
        assertThat(clean.percentile()).isEqualTo(20.0);
        assertThat(clean.dailyRank()).isEqualTo("top 20% cleanest");
        assertThat(average.mode()).isEqualTo(RelativeMode.AVERAGE);
        assertThat(dirty.mode()).isEqualTo(RelativeMode.DIRTY);
        assertThat(dirty.percentile()).isEqualTo(80.0);
        assertThat(dirty.dailyRank()).isEqualTo("top 20% dirtiest");
    }

    @Test
    void trendMagnitudeIsRelativeDeviationFromMean() {
        assertThat(RelativeMetricsEngine.trendMagnitude(150.0, 200.0)).isEqualTo(-25.0);
        assertThat(RelativeMetricsEngine.trendMagnitude(300.0, 200.0)).isEqualTo(50.0);
        assertThat(RelativeMetricsEngine.trendMagnitude(300.0, 0.0)).isZero();
        assertThat(engine.classify(110.0, tenSteps).trendMagnitude()).isEqualTo(100.0);
    }
}
