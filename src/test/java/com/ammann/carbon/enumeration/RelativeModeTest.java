/* (C)2026 */
package com.ammann.carbon.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RelativeModeTest {

    @ParameterizedTest
    @CsvSource({
        "50, CLEAN",
        "100, CLEAN",
        "100.1, AVERAGE",
        "399.9, AVERAGE",
        "400, DIRTY",
        "900, DIRTY"
    })
    void classifiesAgainstThresholds(double value, RelativeMode expected) {
        assertThat(RelativeMode.classify(value, 100.0, 400.0)).isEqualTo(expected);
    }

    @Test
    void degenerateThresholdsPreferClean() {
        assertThat(RelativeMode.classify(200.0, 200.0, 200.0)).isEqualTo(RelativeMode.CLEAN);
    }

    @Test
    void labelsMatchWireFormat() {
        assertThat(RelativeMode.CLEAN.getLabel()).isEqualTo("clean");
        assertThat(RelativeMode.AVERAGE.getLabel()).isEqualTo("average");
        assertThat(RelativeMode.DIRTY.getLabel()).isEqualTo("dirty");
        assertThat(TrendDirection.IMPROVING.getLabel()).isEqualTo("improving");
    }
}
