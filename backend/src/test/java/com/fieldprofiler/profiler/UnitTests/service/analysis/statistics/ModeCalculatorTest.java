package com.fieldprofiler.profiler.service.analysis.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("Mode Calculator Tests")
class ModeCalculatorTest {

  static Stream<ModeCalculator> calculators() {
    return Stream.of(new CommonsMathModeCalculator(), new FrequencyModeCalculator());
  }

  @ParameterizedTest
  @MethodSource("calculators")
  @DisplayName("Should count negative and positive zero as one value")
  void shouldFoldSignedZero(ModeCalculator calculator) {
    assertThat(calculator.computeModes(new double[] {-0.0, 0.0, 1.0})).containsExactly(0.0);
    assertThat(calculator.computeModes(new double[] {-0.0, 0.0})).containsExactly(0.0);
  }

  @Nested
  @DisplayName("Commons Math backed")
  class CommonsMath {

    private final ModeCalculator calculator = new CommonsMathModeCalculator();

    @Test
    @DisplayName("Should return every most frequent value in ascending order")
    void shouldReturnAllModes() {
      assertThat(calculator.computeModes(new double[] {2, 1, 1, 2, 3})).containsExactly(1.0, 2.0);
    }

    @Test
    @DisplayName("Should return the single value of a one element sample")
    void shouldHandleSingleValue() {
      assertThat(calculator.computeModes(new double[] {7})).containsExactly(7.0);
    }
  }

  @Nested
  @DisplayName("Frequency fallback")
  class Frequency {

    private final ModeCalculator calculator = new FrequencyModeCalculator();

    @Test
    @DisplayName("Should return every most frequent value in ascending order")
    void shouldReturnAllModes() {
      assertThat(calculator.computeModes(new double[] {3, 2, 2, 1, 3, 1, 0}))
          .containsExactly(1.0, 2.0, 3.0);
    }
  }
}
