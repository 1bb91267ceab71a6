package com.fieldprofiler.profiler.service.analysis.statistics;

import org.apache.commons.math3.stat.StatUtils;

import com.fieldprofiler.profiler.model.NotApplicableReason;
import com.fieldprofiler.profiler.model.StatValue;

import lombok.extern.slf4j.Slf4j;

/**
 * Moment-based skewness and kurtosis (population, Fisher) plus the Shapiro-Wilk test, computed
 * with Commons Math.
 */
@Slf4j
public class CommonsMathShapeCalculator implements DistributionShapeCalculator {

  private static final double NORMALITY_ALPHA = 0.05;

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public DistributionShape describe(double[] values) {
    if (values.length == 0) {
      return DistributionShape.builder()
          .skewness(StatValue.decimal(Double.NaN))
          .kurtosis(StatValue.decimal(Double.NaN))
          .normalityP(StatValue.notApplicable(NotApplicableReason.ALL_INVALID))
          .likelyNormal(StatValue.notApplicable(NotApplicableReason.ALL_INVALID))
          .build();
    }

    DistributionShape.DistributionShapeBuilder shape =
        DistributionShape.builder()
            .skewness(StatValue.decimal(skewness(values)))
            .kurtosis(StatValue.decimal(kurtosis(values)));

    if (values.length < ShapiroWilk.MIN_SAMPLE_SIZE) {
      StatValue insufficient = StatValue.notApplicable(NotApplicableReason.INSUFFICIENT_DATA);
      return shape.normalityP(insufficient).likelyNormal(insufficient).build();
    }

    try {
      double p = ShapiroWilk.test(values).getPValue();
      return shape
          .normalityP(StatValue.decimal(p))
          .likelyNormal(StatValue.bool(p > NORMALITY_ALPHA))
          .build();
    } catch (IllegalArgumentException e) {
      log.warn("Shapiro-Wilk test failed on {} values: {}", values.length, e.getMessage());
      return shape
          .normalityP(
              StatValue.notApplicable(NotApplicableReason.COMPUTATION_ERROR, e.getMessage()))
          .likelyNormal(StatValue.na())
          .build();
    }
  }

  /** Biased sample skewness m3 / m2^1.5; NaN when the variance is zero. */
  static double skewness(double[] values) {
    double[] moments = centralMoments(values);
    double m2 = moments[1];
    if (isDegenerate(moments[0], m2)) {
      return Double.NaN;
    }
    return moments[2] / Math.pow(m2, 1.5);
  }

  /** Fisher (excess) kurtosis m4 / m2^2 - 3; NaN when the variance is zero. */
  static double kurtosis(double[] values) {
    double[] moments = centralMoments(values);
    double m2 = moments[1];
    if (isDegenerate(moments[0], m2)) {
      return Double.NaN;
    }
    return moments[3] / (m2 * m2) - 3.0;
  }

  // variance indistinguishable from rounding noise around the mean
  private static boolean isDegenerate(double mean, double m2) {
    double noise = Math.ulp(1.0) * mean;
    return m2 <= noise * noise;
  }

  /** Mean followed by the second, third and fourth central moments, divided by n. */
  private static double[] centralMoments(double[] values) {
    double mean = StatUtils.mean(values);
    double m2 = 0;
    double m3 = 0;
    double m4 = 0;
    for (double value : values) {
      double d = value - mean;
      double d2 = d * d;
      m2 += d2;
      m3 += d2 * d;
      m4 += d2 * d2;
    }
    int n = values.length;
    return new double[] {mean, m2 / n, m3 / n, m4 / n};
  }
}
