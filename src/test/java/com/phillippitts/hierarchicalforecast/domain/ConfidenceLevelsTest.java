package com.phillippitts.hierarchicalforecast.domain;

import com.phillippitts.hierarchicalforecast.exception.InvalidConfidenceLevelException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfidenceLevelsTest {

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 100.0, -5.0, 150.0, Double.NaN})
    void rejectsLevelsOutsideOpenInterval(double level) {
        assertThatThrownBy(() -> ConfidenceLevels.requireValid(level))
                .isInstanceOf(InvalidConfidenceLevelException.class);
    }

    @Test
    void acceptsLevelsInsideOpenInterval() {
        assertThat(ConfidenceLevels.requireValid(0.5)).isEqualTo(0.5);
        assertThat(ConfidenceLevels.requireValid(99.9)).isEqualTo(99.9);
    }

    @Test
    void formatsWholeLevelsWithoutFraction() {
        assertThat(ConfidenceLevels.format(80.0)).isEqualTo("80");
        assertThat(ConfidenceLevels.format(97.5)).isEqualTo("97.5");
        assertThat(ConfidenceLevels.format(99.90)).isEqualTo("99.9");
    }
}
