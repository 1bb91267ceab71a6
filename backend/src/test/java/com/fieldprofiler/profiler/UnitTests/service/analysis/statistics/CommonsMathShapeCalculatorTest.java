package com.fieldprofiler.profiler.service.analysis.statistics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.StatValue;

@DisplayName("CommonsMathShapeCalculator Tests")
class CommonsMathShapeCalculatorTest {

  private final CommonsMathShapeCalculator calculator = new CommonsMathShapeCalculator();

  @Test
  @DisplayName("Should compute zero skewness for a symmetric sample")
  void shouldComputeSymmetricSkewness() {
    DistributionShape shape = calculator.describe(new double[] {1, 2, 3, 4, 5});

    assertThat(shape.getSkewness().asDouble()).isCloseTo(0.0, within(1e-12));
    // excess kurtosis of a discrete uniform sample of five points
    assertThat(shape.getKurtosis().asDouble()).isCloseTo(-1.3, within(1e-12));
    assertThat(shape.getNormalityP().getKind()).isEqualTo(StatValue.Kind.DECIMAL);
    assertThat(shape.getLikelyNormal().asBoolean()).isTrue();
  }

  @Test
  @DisplayName("Should report insufficient data below three values")
  void shouldFlagInsufficientData() {
    DistributionShape shape = calculator.describe(new double[] {1, 2});

    assertThat(shape.getNormalityP().getReason()).isEqualTo(NotApplicableReason.INSUFFICIENT_DATA);
    assertThat(shape.getLikelyNormal().getReason())
        .isEqualTo(NotApplicableReason.INSUFFICIENT_DATA);
  }

  @Test
  @DisplayName("Should report NaN shape and all-invalid normality for an empty sample")
  void shouldHandleEmptySample() {
    DistributionShape shape = calculator.describe(new double[0]);

    assertThat(shape.getSkewness().asDouble()).isNaN();
    assertThat(shape.getKurtosis().asDouble()).isNaN();
    assertThat(shape.getNormalityP().getReason()).isEqualTo(NotApplicableReason.ALL_INVALID);
  }

  @Test
  @DisplayName("Should give NaN skewness and kurtosis for constant values")
  void shouldReturnNaNForConstantValues() {
    assertThat(CommonsMathShapeCalculator.skewness(new double[] {0.1, 0.1, 0.1})).isNaN();
    assertThat(CommonsMathShapeCalculator.kurtosis(new double[] {0.1, 0.1, 0.1})).isNaN();
  }

  @Test
  @DisplayName("Unavailable calculator should mark everything as missing capability")
  void unavailableCalculatorShouldFlagCapability() {
    DistributionShape shape = new UnavailableShapeCalculator().describe(new double[] {1, 2, 3});

    assertThat(shape.getSkewness().getReason()).isEqualTo(NotApplicableReason.CAPABILITY_MISSING);
    assertThat(shape.getLikelyNormal().getReason())
        .isEqualTo(NotApplicableReason.CAPABILITY_MISSING);
  }
}
