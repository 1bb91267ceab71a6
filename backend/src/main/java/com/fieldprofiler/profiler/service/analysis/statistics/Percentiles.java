package com.fieldprofiler.profiler.service.analysis.statistics;

/** Percentiles by linear interpolation between closest ranks. */
public final class Percentiles {

  private Percentiles() {}

  /**
   * Returns the {@code percent}-th percentile of {@code sorted}, which must be in ascending order
   * and free of NaN. Returns NaN for an empty array.
   */
  public static double linear(double[] sorted, double percent) {
    if (percent < 0 || percent > 100) {
      throw new IllegalArgumentException("percent must be within [0, 100], was " + percent);
    }
    int n = sorted.length;
    if (n == 0) {
      return Double.NaN;
    }
    if (n == 1) {
      return sorted[0];
    }
    double rank = (n - 1) * (percent / 100.0);
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    if (lower == upper) {
      return sorted[lower];
    }
    double fraction = rank - lower;
    return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
  }
}
