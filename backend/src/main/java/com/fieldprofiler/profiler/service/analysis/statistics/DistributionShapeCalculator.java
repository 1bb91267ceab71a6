package com.fieldprofiler.profiler.service.analysis.statistics;

/**
 * Skewness, kurtosis and normality for a numeric sample. One implementation is chosen at startup
 * depending on whether the statistics library is available.
 */
public interface DistributionShapeCalculator {

  boolean isAvailable();

  /**
   * @param values the NaN-free subset of the field's values; may be empty
   */
  DistributionShape describe(double[] values);
}
